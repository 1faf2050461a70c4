package com.tencent.hpcflow.client.dto.request;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
public class ConfigureEnvironmentRequest {

    private Map<String, String> variables = new LinkedHashMap<>();

    /**
     * 追加的模块，同名模块替换原有版本
     */
    private List<String> modules = new ArrayList<>();
}
