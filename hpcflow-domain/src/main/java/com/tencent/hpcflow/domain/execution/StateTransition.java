package com.tencent.hpcflow.domain.execution;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * StateTransition - 一次状态迁移
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StateTransition {

    private ExecutionState from;

    private ExecutionState to;

    private Instant at;

    private String reason;
}
