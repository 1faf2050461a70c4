package com.tencent.hpcflow.domain.repository;

import com.tencent.hpcflow.domain.environment.Environment;

import java.util.List;
import java.util.Optional;

/**
 * EnvironmentRepository - 命名环境仓储接口
 */
public interface EnvironmentRepository {

    /**
     * 保存或覆盖同名环境
     */
    void save(Environment environment);

    Optional<Environment> findByName(String name);

    List<Environment> findAll();

    boolean delete(String name);
}
