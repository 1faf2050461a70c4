package com.tencent.hpcflow.infrastructure.persistence.execution;

import com.tencent.hpcflow.domain.execution.ExecutionRecord;
import com.tencent.hpcflow.domain.repository.ExecutionRepository;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * InMemoryExecutionRepository - 进程内执行记录存储
 * <p>
 * 执行记录随进程生命周期存在；保存与读取都复制快照，调用方拿到的对象互不影响。
 * </p>
 *
 * @author hpcflow
 */
@Repository
public class InMemoryExecutionRepository implements ExecutionRepository {

    private final Map<String, ExecutionRecord> records = new ConcurrentHashMap<>();

    @Override
    public void save(ExecutionRecord record) {
        records.put(record.getId(), record.copy());
    }

    @Override
    public Optional<ExecutionRecord> findById(String executionId) {
        return Optional.ofNullable(records.get(executionId)).map(ExecutionRecord::copy);
    }

    @Override
    public List<ExecutionRecord> findByPipeline(String pipelineName) {
        return records.values().stream()
                .filter(r -> r.getPipelineName().equals(pipelineName))
                .sorted(Comparator.comparing(ExecutionRecord::getStartedAt).reversed())
                .map(ExecutionRecord::copy)
                .collect(Collectors.toList());
    }

    @Override
    public void delete(String executionId) {
        records.remove(executionId);
    }
}
