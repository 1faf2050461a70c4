package com.tencent.hpcflow.infrastructure.persistence.pipeline.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.tencent.hpcflow.infrastructure.persistence.pipeline.entity.PackageEntryDO;
import org.apache.ibatis.annotations.Mapper;

/**
 * PackageEntryMapper - 流水线包Mapper
 *
 * @author hpcflow
 */
@Mapper
public interface PackageEntryMapper extends BaseMapper<PackageEntryDO> {
}
