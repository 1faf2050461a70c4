package com.tencent.hpcflow.app.dto;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 流水线描述文件的 YAML 结构
 */
@Data
@JsonPropertyOrder({"name", "description", "env", "pkgs"})
public class PipelineDescriptorDto {

    private String name;

    private String description;

    /**
     * 关联的命名环境
     */
    private String env;

    private List<PackageDescriptorDto> pkgs = new ArrayList<>();
}
