package com.tencent.hpcflow.domain.pipeline;

/**
 * PipelineStatus - 流水线状态
 * <p>
 * 运行类状态镜像最近一次执行的生命周期。
 * </p>
 */
public enum PipelineStatus {

    CREATED,

    CONFIGURED,

    RUNNING,

    STOPPED,

    FAILED,

    COMPLETED
}
