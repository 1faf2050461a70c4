package com.tencent.hpcflow.client.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.Map;

@Data
public class ConfigurePackageRequest {

    @NotNull
    private Map<String, Object> config;
}
