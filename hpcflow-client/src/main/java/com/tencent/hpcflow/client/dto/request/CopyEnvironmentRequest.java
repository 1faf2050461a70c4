package com.tencent.hpcflow.client.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class CopyEnvironmentRequest {

    @NotBlank
    private String target;
}
