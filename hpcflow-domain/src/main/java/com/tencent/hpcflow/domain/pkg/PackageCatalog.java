package com.tencent.hpcflow.domain.pkg;

import java.util.Collection;
import java.util.Optional;

/**
 * PackageCatalog - 包目录（外部协作者）
 * <p>
 * 包仓库的发现与管理不在编排核心范围内，这里只声明查询契约。
 * </p>
 */
public interface PackageCatalog {

    /**
     * 按包名查找声明
     */
    Optional<PackageDefinition> find(String packageName);

    /**
     * 所有已知的包
     */
    Collection<PackageDefinition> findAll();
}
