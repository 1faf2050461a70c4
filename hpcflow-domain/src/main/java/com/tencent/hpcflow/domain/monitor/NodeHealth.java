package com.tencent.hpcflow.domain.monitor;

/**
 * NodeHealth - 监控视角下的节点健康度
 */
public enum NodeHealth {

    /**
     * 尚未收到心跳
     */
    PENDING,

    HEALTHY,

    /**
     * 超过心跳超时未收到心跳
     */
    UNRESPONSIVE,

    /**
     * 节点已结束
     */
    FINISHED
}
