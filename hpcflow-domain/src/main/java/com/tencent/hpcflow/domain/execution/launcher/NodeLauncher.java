package com.tencent.hpcflow.domain.execution.launcher;

import com.tencent.hpcflow.domain.execution.ExecutionMethod;
import com.tencent.hpcflow.domain.execution.ExecutionMethodConfig;
import com.tencent.hpcflow.domain.schedule.NodeAssignment;

/**
 * NodeLauncher - 节点启动器
 * <p>
 * 每种执行方式一个实现，编排器在计划阶段按执行方式选择。
 * 生产环境通过进程、SSH 或 mpirun 启动；测试中可以使用可编排的假实现。
 * </p>
 */
public interface NodeLauncher {

    /**
     * 支持的执行方式
     */
    ExecutionMethod method();

    /**
     * 在节点上启动会话，不等待就绪
     * @param request 启动参数
     * @return 节点会话
     */
    NodeSession launch(NodeLaunchRequest request);

    /**
     * 清理节点上某次执行留下的工作目录
     * @param executionId 执行 ID
     * @param assignment 节点分配
     * @param methodConfig 执行方式参数
     * @param preserveLogs 是否保留日志
     * @param preserveOutputs 是否保留输出
     */
    default void clean(String executionId, NodeAssignment assignment, ExecutionMethodConfig methodConfig,
                       boolean preserveLogs, boolean preserveOutputs) {
    }
}
