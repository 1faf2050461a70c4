package com.tencent.hpcflow.infrastructure.persistence.environment.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.tencent.hpcflow.infrastructure.persistence.environment.entity.EnvironmentDO;
import org.apache.ibatis.annotations.Mapper;

/**
 * EnvironmentMapper - 命名环境Mapper
 *
 * @author hpcflow
 */
@Mapper
public interface EnvironmentMapper extends BaseMapper<EnvironmentDO> {
}
