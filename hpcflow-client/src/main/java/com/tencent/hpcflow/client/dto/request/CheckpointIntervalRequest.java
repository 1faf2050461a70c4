package com.tencent.hpcflow.client.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

@Data
public class CheckpointIntervalRequest {

    @NotNull
    @Positive
    private Long intervalSeconds;
}
