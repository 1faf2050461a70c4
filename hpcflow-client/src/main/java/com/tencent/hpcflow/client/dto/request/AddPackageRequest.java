package com.tencent.hpcflow.client.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 向流水线添加包
 */
@Data
public class AddPackageRequest {

    @NotBlank
    private String packageName;

    /**
     * service、application 或 interceptor，为空时采用包目录中的类型
     */
    private String type;

    private Map<String, Object> config = new LinkedHashMap<>();

    /**
     * 插入位置，为空时追加到末尾
     */
    @PositiveOrZero
    private Integer position;
}
