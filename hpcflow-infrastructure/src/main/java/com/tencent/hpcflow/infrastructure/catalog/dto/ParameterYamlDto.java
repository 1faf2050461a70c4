package com.tencent.hpcflow.infrastructure.catalog.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;

@Data
public class ParameterYamlDto {
    private String name;
    private String type;
    private boolean required;
    private String description;
    @JsonProperty("default")
    private Object defaultValue;
    private String pattern;
    private Integer minLength;
    private Integer maxLength;
    @JsonProperty("enum")
    private List<Object> enumValues;
    private Double min;
    private Double max;
}
