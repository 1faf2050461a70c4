package com.tencent.hpcflow.domain.checkpoint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tencent.hpcflow.domain.exception.IntegrityException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 以 JSON 文本保存检查点，便于测试篡改内容
 */
public class InMemoryCheckpointStore implements CheckpointStore {

    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final Map<String, TreeMap<String, String>> store = new ConcurrentHashMap<>();

    private final AtomicInteger pendingWriteFailures = new AtomicInteger();

    private final AtomicInteger failedWrites = new AtomicInteger();

    @Override
    public void write(Checkpoint checkpoint) {
        if (pendingWriteFailures.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            failedWrites.incrementAndGet();
            throw new UncheckedIOException("disk full", new IOException("No space left on device"));
        }
        try {
            store.computeIfAbsent(checkpoint.getExecutionId(), id -> new TreeMap<>())
                    .put(checkpoint.getId(), mapper.writeValueAsString(checkpoint));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }

    @Override
    public Optional<Checkpoint> read(String executionId, String checkpointId) {
        String json = store.getOrDefault(executionId, new TreeMap<>()).get(checkpointId);
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(json, Checkpoint.class));
        } catch (JsonProcessingException e) {
            throw new IntegrityException("checkpoint:" + checkpointId, "Unreadable checkpoint", e);
        }
    }

    @Override
    public List<String> listIds(String executionId) {
        return new ArrayList<>(store.getOrDefault(executionId, new TreeMap<>()).keySet());
    }

    @Override
    public void delete(String executionId, String checkpointId) {
        store.getOrDefault(executionId, new TreeMap<>()).remove(checkpointId);
    }

    @Override
    public void deleteAll(String executionId) {
        store.remove(executionId);
    }

    /**
     * 直接改写已保存的文本
     */
    public void tamper(String executionId, String checkpointId, String from, String to) {
        TreeMap<String, String> checkpoints = store.get(executionId);
        checkpoints.put(checkpointId, checkpoints.get(checkpointId).replace(from, to));
    }

    /**
     * 接下来的 count 次写入抛出 I/O 异常
     */
    public void failNextWrites(int count) {
        pendingWriteFailures.set(count);
    }

    public int failedWrites() {
        return failedWrites.get();
    }

    public String raw(String executionId, String checkpointId) {
        return store.get(executionId).get(checkpointId);
    }
}
