package com.tencent.hpcflow.domain.checkpoint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tencent.hpcflow.domain.exception.IntegrityException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * CheckpointDigest - 检查点完整性摘要
 * <p>
 * 对 digest 置空后的规范 JSON（属性与 Map 键排序）计算 SHA-256。
 * </p>
 */
public final class CheckpointDigest {

    private static final ObjectMapper CANONICAL = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    private CheckpointDigest() {
    }

    public static String compute(Checkpoint checkpoint) {
        String digest = checkpoint.getDigest();
        checkpoint.setDigest(null);
        try {
            byte[] canonical = CANONICAL.writeValueAsString(checkpoint).getBytes(StandardCharsets.UTF_8);
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(canonical));
        } catch (JsonProcessingException | NoSuchAlgorithmException e) {
            throw new IntegrityException("checkpoint:" + checkpoint.getId(),
                    "Cannot compute digest of checkpoint " + checkpoint.getId(), e);
        } finally {
            checkpoint.setDigest(digest);
        }
    }

    public static void seal(Checkpoint checkpoint) {
        checkpoint.setDigest(compute(checkpoint));
    }

    public static boolean verify(Checkpoint checkpoint) {
        return checkpoint.getDigest() != null && checkpoint.getDigest().equals(compute(checkpoint));
    }
}
