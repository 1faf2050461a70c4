package com.tencent.hpcflow.infrastructure.catalog.dto;

import lombok.Data;

import java.util.List;

@Data
public class PackageCatalogYamlDto {
    private List<PackageYamlDto> packages;
}
