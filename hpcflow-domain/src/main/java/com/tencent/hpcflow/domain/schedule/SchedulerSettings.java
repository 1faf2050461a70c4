package com.tencent.hpcflow.domain.schedule;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * SchedulerSettings - 调度参数
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchedulerSettings {

    /**
     * 可接受的资源快照最大年龄
     */
    @Builder.Default
    private Duration maxGraphAge = Duration.ofMinutes(5);

    @Builder.Default
    private AllocationStrategy defaultStrategy = AllocationStrategy.BALANCED;
}
