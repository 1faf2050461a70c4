package com.tencent.hpcflow.infrastructure.catalog.dto;

import lombok.Data;

import java.util.List;

@Data
public class PackageYamlDto {
    private String name;
    private String type; // service | application | interceptor
    private String description;
    private String command;
    private Integer cores;
    private Long memoryMb;
    private Long storageGb;
    private boolean storageService;
    private boolean resumable;
    private Integer preloadPriority;
    private List<String> modules;
    private List<String> dependencies;
    private List<String> conflicts;
    private List<String> complements;
    private List<ParameterYamlDto> parameters;
}
