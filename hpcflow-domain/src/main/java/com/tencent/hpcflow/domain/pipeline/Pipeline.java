package com.tencent.hpcflow.domain.pipeline;

import com.tencent.hpcflow.domain.environment.Environment;
import com.tencent.hpcflow.domain.exception.NotFoundException;
import com.tencent.hpcflow.domain.execution.ExecutionMethodConfig;
import com.tencent.hpcflow.domain.pkg.PackageType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Pipeline - 流水线
 * <p>
 * 由有序包列表构成的可部署工作流。包顺序是全序，
 * 增删改后 order 始终为 0..n-1 的连续编号。
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Pipeline {

    /**
     * 流水线名称，全局唯一
     */
    private String name;

    private String description;

    /**
     * 有序包列表
     */
    @Builder.Default
    private List<PackageEntry> entries = new ArrayList<>();

    /**
     * 关联的环境快照，未构建时为空
     */
    private Environment environment;

    /**
     * 执行方式配置，未配置时按 local 运行
     */
    private ExecutionMethodConfig executionMethod;

    @Builder.Default
    private PipelineStatus status = PipelineStatus.CREATED;

    private Instant createdAt;

    private Instant updatedAt;

    /**
     * 乐观锁版本号，存储层用于检测并发修改
     */
    private Integer revision;

    public Optional<PackageEntry> findEntry(String packageName) {
        return entries.stream().filter(e -> e.getName().equals(packageName)).findFirst();
    }

    public PackageEntry entry(String packageName) {
        return findEntry(packageName).orElseThrow(() -> new NotFoundException("package:" + packageName,
                "Package '" + packageName + "' is not part of pipeline '" + name + "'"));
    }

    public boolean contains(String packageName) {
        return findEntry(packageName).isPresent();
    }

    public List<String> entryNames() {
        return entries.stream().map(PackageEntry::getName).collect(Collectors.toList());
    }

    public List<PackageEntry> entriesOfType(PackageType type) {
        return entries.stream().filter(e -> e.getType() == type).collect(Collectors.toList());
    }

    /**
     * 按列表位置重新编号
     */
    public void resequence() {
        for (int i = 0; i < entries.size(); i++) {
            entries.get(i).setOrder(i);
        }
    }

    /**
     * 深拷贝，用于生成执行时的只读视图
     */
    public Pipeline copy() {
        List<PackageEntry> copied = entries.stream().map(PackageEntry::copy).collect(Collectors.toList());
        return new Pipeline(name, description, copied,
                environment == null ? null : environment.copy(environment.getName()),
                executionMethod == null ? null : executionMethod.copy(),
                status, createdAt, updatedAt, revision);
    }
}
