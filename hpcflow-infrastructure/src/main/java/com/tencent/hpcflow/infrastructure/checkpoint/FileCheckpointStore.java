package com.tencent.hpcflow.infrastructure.checkpoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tencent.hpcflow.domain.checkpoint.Checkpoint;
import com.tencent.hpcflow.domain.checkpoint.CheckpointStore;
import com.tencent.hpcflow.domain.exception.IntegrityException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * FileCheckpointStore - 基于文件的检查点存储
 * <p>
 * 每个执行一个目录，每个检查点一个 JSON 文件。先写临时文件再原子改名，
 * 读取方不会看到写了一半的检查点。
 * </p>
 *
 * @author hpcflow
 */
@Slf4j
public class FileCheckpointStore implements CheckpointStore {

    private static final String SUFFIX = ".json";

    private static final String TEMP_SUFFIX = ".tmp";

    private final Path root;

    private final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public FileCheckpointStore(Path root) {
        this.root = root;
    }

    @Override
    public void write(Checkpoint checkpoint) {
        Path dir = root.resolve(checkpoint.getExecutionId());
        Path target = dir.resolve(checkpoint.getId() + SUFFIX);
        try {
            Files.createDirectories(dir);
            Path temp = Files.createTempFile(dir, checkpoint.getId(), TEMP_SUFFIX);
            try {
                mapper.writeValue(temp.toFile(), checkpoint);
                move(temp, target);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write checkpoint " + target, e);
        }
        log.debug("Wrote checkpoint {}", target);
    }

    @Override
    public Optional<Checkpoint> read(String executionId, String checkpointId) {
        Path file = root.resolve(executionId).resolve(checkpointId + SUFFIX);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(file.toFile(), Checkpoint.class));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new IntegrityException("checkpoint:" + checkpointId,
                    "Checkpoint " + checkpointId + " of execution " + executionId + " is unreadable: "
                            + e.getMessage(), e);
        }
    }

    @Override
    public List<String> listIds(String executionId) {
        Path dir = root.resolve(executionId);
        if (!Files.isDirectory(dir)) {
            return Collections.emptyList();
        }
        List<String> ids = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(dir, "*" + SUFFIX)) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                ids.add(name.substring(0, name.length() - SUFFIX.length()));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list checkpoints in " + dir, e);
        }
        // 检查点 ID 定宽编号，字典序即序号顺序
        Collections.sort(ids);
        return ids;
    }

    @Override
    public void delete(String executionId, String checkpointId) {
        try {
            Files.deleteIfExists(root.resolve(executionId).resolve(checkpointId + SUFFIX));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete checkpoint " + checkpointId, e);
        }
    }

    @Override
    public void deleteAll(String executionId) {
        Path dir = root.resolve(executionId);
        if (!Files.isDirectory(dir)) {
            return;
        }
        try (DirectoryStream<Path> files = Files.newDirectoryStream(dir)) {
            for (Path file : files) {
                Files.deleteIfExists(file);
            }
            Files.deleteIfExists(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete checkpoints of execution " + executionId, e);
        }
        log.info("Deleted all checkpoints of execution {}", executionId);
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for {}, falling back to replace", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
