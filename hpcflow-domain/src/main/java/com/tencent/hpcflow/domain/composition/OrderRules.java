package com.tencent.hpcflow.domain.composition;

import com.tencent.hpcflow.domain.pipeline.PackageEntry;
import com.tencent.hpcflow.domain.pkg.PackageCatalog;
import com.tencent.hpcflow.domain.pkg.PackageDefinition;
import com.tencent.hpcflow.domain.pkg.PackageType;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * OrderRules - 包顺序约束
 * <p>
 * 两条规则：声明的依赖包若在流水线中，必须排在前面；
 * 拦截器之间按 preloadPriority 非递减排列（未声明优先级的不受约束）。
 * </p>
 */
class OrderRules {

    private final PackageCatalog packageCatalog;

    OrderRules(PackageCatalog packageCatalog) {
        this.packageCatalog = packageCatalog;
    }

    /**
     * @return 违反的约束描述，空列表表示顺序合法
     */
    List<String> violations(List<PackageEntry> entries) {
        List<String> problems = new ArrayList<>();
        Map<String, Integer> positions = new HashMap<>();
        for (int i = 0; i < entries.size(); i++) {
            positions.put(entries.get(i).getName(), i);
        }

        PackageEntry lastInterceptor = null;
        int lastPriority = Integer.MIN_VALUE;
        for (int i = 0; i < entries.size(); i++) {
            PackageEntry entry = entries.get(i);
            Optional<PackageDefinition> definition = packageCatalog.find(entry.getName());
            if (definition.isEmpty()) {
                continue;
            }
            for (String dependency : definition.get().getDependencies()) {
                Integer at = positions.get(dependency);
                if (at != null && at > i) {
                    problems.add("'" + entry.getName() + "' depends on '" + dependency
                            + "' and must come after it");
                }
            }
            Integer priority = definition.get().getPreloadPriority();
            if (entry.getType() == PackageType.INTERCEPTOR && priority != null) {
                if (priority < lastPriority) {
                    problems.add("interceptor '" + entry.getName() + "' (priority " + priority
                            + ") must precede '" + lastInterceptor.getName() + "' (priority " + lastPriority + ")");
                } else {
                    lastPriority = priority;
                    lastInterceptor = entry;
                }
            }
        }
        return problems;
    }
}
