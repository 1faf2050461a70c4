package com.tencent.hpcflow.app.dto;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@JsonPropertyOrder({"name", "type", "config"})
public class PackageDescriptorDto {

    private String name;

    private String type;

    private Map<String, Object> config = new LinkedHashMap<>();
}
