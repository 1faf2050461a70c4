package com.tencent.hpcflow.client.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class BuildEnvironmentRequest {

    @NotBlank
    private String name;

    /**
     * 构建所依据并随后关联的流水线
     */
    @NotBlank
    private String pipeline;

    /**
     * fast、balanced 或 aggressive，缺省 balanced
     */
    private String optimizationLevel;

    private boolean devTools;
}
