package com.tencent.hpcflow.domain.repository;

import com.tencent.hpcflow.domain.execution.ExecutionRecord;

import java.util.List;
import java.util.Optional;

/**
 * ExecutionRepository - 执行记录仓储接口
 * <p>
 * 保存的是执行记录在某次状态迁移后的快照。
 * </p>
 */
public interface ExecutionRepository {

    void save(ExecutionRecord record);

    Optional<ExecutionRecord> findById(String executionId);

    /**
     * 按开始时间倒序返回某条流水线的全部执行记录
     */
    List<ExecutionRecord> findByPipeline(String pipelineName);

    void delete(String executionId);
}
