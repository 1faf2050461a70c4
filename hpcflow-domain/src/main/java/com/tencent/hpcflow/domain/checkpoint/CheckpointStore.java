package com.tencent.hpcflow.domain.checkpoint;

import java.util.List;
import java.util.Optional;

/**
 * CheckpointStore - 检查点存储
 * <p>
 * 写入必须是原子的：读取方要么看不到这个检查点，要么看到完整内容。
 * </p>
 */
public interface CheckpointStore {

    /**
     * 持久化检查点，返回前已落盘
     */
    void write(Checkpoint checkpoint);

    /**
     * 读取检查点
     *
     * @throws com.tencent.hpcflow.domain.exception.IntegrityException 内容无法解析
     */
    Optional<Checkpoint> read(String executionId, String checkpointId);

    /**
     * 按序号升序返回检查点 ID
     */
    List<String> listIds(String executionId);

    void delete(String executionId, String checkpointId);

    void deleteAll(String executionId);
}
