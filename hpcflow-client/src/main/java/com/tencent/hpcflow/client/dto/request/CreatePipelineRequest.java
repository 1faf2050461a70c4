package com.tencent.hpcflow.client.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class CreatePipelineRequest {

    @NotBlank
    private String name;

    private String description;
}
