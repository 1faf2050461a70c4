package com.tencent.hpcflow.domain.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Event - 领域事件
 * <p>
 * 编排器、节点会话与监控之间传递的消息单元。
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Event {

    /**
     * 事件唯一标识 (UUID)
     */
    @Builder.Default
    private String id = UUID.randomUUID().toString();

    /**
     * 事件类型
     * <p>
     * 格式: {domain}.{entity}.{action}，取值见 {@link ExecutionEvents}
     * </p>
     */
    private String type;

    /**
     * 事件源
     * <p>
     * 示例: "/executions/{executionId}/nodes/{nodeId}"
     * </p>
     */
    private String source;

    @Builder.Default
    private Instant time = Instant.now();

    /**
     * 关联的流水线名称
     */
    private String pipelineName;

    /**
     * 关联的执行记录 ID
     */
    private String executionId;

    /**
     * 关联的节点编号，执行级事件为空
     */
    private Integer nodeId;

    /**
     * 事件负载
     */
    @Builder.Default
    private Map<String, Object> payload = new HashMap<>();

    /**
     * 扩展属性
     */
    @Builder.Default
    private Map<String, String> attributes = new HashMap<>();
}
