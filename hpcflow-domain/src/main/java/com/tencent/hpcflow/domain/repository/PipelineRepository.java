package com.tencent.hpcflow.domain.repository;

import com.tencent.hpcflow.domain.pipeline.Pipeline;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.Optional;

/**
 * PipelineRepository - 流水线存储仓储接口
 * <p>
 * 每次修改立即持久化；更新时按 revision 做乐观锁校验。
 * </p>
 *
 * @author hpcflow
 */
public interface PipelineRepository {

    /**
     * 新建流水线，成功后 revision 被置为初始值
     *
     * @param pipeline 流水线，不能为空
     * @throws com.tencent.hpcflow.domain.exception.ConflictException 名称已存在
     */
    void insert(@NotNull Pipeline pipeline);

    /**
     * 更新流水线，成功后 revision 自增
     *
     * @param pipeline 携带读取时 revision 的流水线
     * @throws com.tencent.hpcflow.domain.exception.ConflictException revision 已过期
     * @throws com.tencent.hpcflow.domain.exception.NotFoundException 流水线不存在
     */
    void update(@NotNull Pipeline pipeline);

    /**
     * 根据名称查找流水线
     */
    Optional<Pipeline> findByName(@NotBlank String name);

    /**
     * 按名称排序返回全部流水线
     */
    List<Pipeline> findAll();

    /**
     * 删除流水线
     *
     * @return 是否删除了记录
     */
    boolean delete(@NotBlank String name);

    boolean exists(@NotBlank String name);
}
