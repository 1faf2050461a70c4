package com.tencent.hpcflow.domain.pipeline;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * InterceptorSlot - 拦截器在预加载链中的位置
 * <p>
 * 拦截器包裹所在节点上的全部应用，targetPackages 即流水线中的应用包。
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InterceptorSlot {

    private String name;

    /**
     * 在预加载链中的位置，从 1 开始
     */
    private int preloadOrder;

    /**
     * 包目录声明的优先级，未声明时为空
     */
    private Integer preloadPriority;

    @Builder.Default
    private Map<String, Object> config = new LinkedHashMap<>();

    @Builder.Default
    private List<String> targetPackages = new ArrayList<>();
}
