package com.tencent.hpcflow.domain.monitor;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * AlertRule - 告警规则
 * <p>
 * condition 是以 {@link NodeFrame} 为根对象的 SpEL 表达式，
 * 整个监控帧可通过 #frame 访问。
 * 示例: "latest != null and latest.cpu > 95"
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertRule {

    private String name;

    private String condition;

    /**
     * 告警文本，可用 {node} 占位节点编号
     */
    private String message;
}
