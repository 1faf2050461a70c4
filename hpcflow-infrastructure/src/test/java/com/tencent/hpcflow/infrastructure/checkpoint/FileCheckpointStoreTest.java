package com.tencent.hpcflow.infrastructure.checkpoint;

import com.tencent.hpcflow.domain.checkpoint.Checkpoint;
import com.tencent.hpcflow.domain.checkpoint.CheckpointDigest;
import com.tencent.hpcflow.domain.checkpoint.NodeProgress;
import com.tencent.hpcflow.domain.exception.IntegrityException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileCheckpointStoreTest {

    @TempDir
    Path root;

    private FileCheckpointStore store;

    @BeforeEach
    void setUp() {
        store = new FileCheckpointStore(root);
    }

    @Test
    void testWriteThenReadKeepsDigestValid() {
        Checkpoint checkpoint = checkpoint("exec-1", 1);

        store.write(checkpoint);
        Checkpoint read = store.read("exec-1", "cp-000001").orElseThrow();

        assertEquals(checkpoint.getDigest(), read.getDigest());
        assertTrue(CheckpointDigest.verify(read));
        assertEquals(1, read.getNodes().get(0).getLastCompletedIndex());
        assertEquals("step1", read.getNodes().get(0).getResumableState().get("last_package"));
    }

    @Test
    void testNoTemporaryFilesRemain() throws IOException {
        store.write(checkpoint("exec-1", 1));
        store.write(checkpoint("exec-1", 2));

        try (Stream<Path> files = Files.list(root.resolve("exec-1"))) {
            assertTrue(files.allMatch(f -> f.getFileName().toString().endsWith(".json")));
        }
    }

    @Test
    void testListIdsInSequenceOrder() {
        store.write(checkpoint("exec-1", 10));
        store.write(checkpoint("exec-1", 2));
        store.write(checkpoint("exec-1", 1));

        assertEquals(List.of("cp-000001", "cp-000002", "cp-000010"), store.listIds("exec-1"));
        assertEquals(List.of(), store.listIds("exec-2"));
    }

    @Test
    void testTruncatedFileIsIntegrityError() throws IOException {
        store.write(checkpoint("exec-1", 1));
        Files.writeString(root.resolve("exec-1").resolve("cp-000001.json"), "{\"id\":\"cp-0");

        assertThrows(IntegrityException.class, () -> store.read("exec-1", "cp-000001"));
    }

    @Test
    void testTamperedContentFailsVerification() throws IOException {
        store.write(checkpoint("exec-1", 1));
        Path file = root.resolve("exec-1").resolve("cp-000001.json");
        Files.writeString(file, Files.readString(file).replace("\"lastCompletedIndex\":1", "\"lastCompletedIndex\":3"));

        assertFalse(CheckpointDigest.verify(store.read("exec-1", "cp-000001").orElseThrow()));
    }

    @Test
    void testDelete() {
        store.write(checkpoint("exec-1", 1));
        store.write(checkpoint("exec-1", 2));

        store.delete("exec-1", "cp-000001");
        assertEquals(List.of("cp-000002"), store.listIds("exec-1"));
        assertTrue(store.read("exec-1", "cp-000001").isEmpty());

        store.deleteAll("exec-1");
        assertFalse(Files.exists(root.resolve("exec-1")));
    }

    private static Checkpoint checkpoint(String executionId, long sequence) {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("last_package", "step1");
        Map<Integer, NodeProgress> nodes = new TreeMap<>();
        nodes.put(0, NodeProgress.builder()
                .nodeId(0)
                .host("node0")
                .lastCompletedIndex(1)
                .completedPackages(new ArrayList<>(List.of("step0", "step1")))
                .resumableState(state)
                .build());
        Checkpoint checkpoint = Checkpoint.builder()
                .id(Checkpoint.idFor(sequence))
                .executionId(executionId)
                .pipelineName("chain")
                .sequence(sequence)
                .planId("plan-1")
                .nodes(nodes)
                .createdAt(Instant.parse("2026-10-17T08:00:00Z"))
                .build();
        CheckpointDigest.seal(checkpoint);
        return checkpoint;
    }
}
