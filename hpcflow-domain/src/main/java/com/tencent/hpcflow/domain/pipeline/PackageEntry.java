package com.tencent.hpcflow.domain.pipeline;

import com.tencent.hpcflow.domain.pkg.PackageType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * PackageEntry - 流水线中的一个包
 * <p>
 * 包名在流水线内唯一；order 是包在流水线中的位置，从 0 开始连续编号。
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PackageEntry {

    /**
     * 包名，对应包目录中的声明
     */
    private String name;

    private PackageType type;

    /**
     * 已按参数 Schema 校验并补全默认值的配置
     */
    @Builder.Default
    private Map<String, Object> config = new LinkedHashMap<>();

    private int order;

    public PackageEntry copy() {
        return new PackageEntry(name, type, new LinkedHashMap<>(config), order);
    }
}
