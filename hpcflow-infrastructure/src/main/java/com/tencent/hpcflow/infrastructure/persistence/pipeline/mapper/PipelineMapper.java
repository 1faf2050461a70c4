package com.tencent.hpcflow.infrastructure.persistence.pipeline.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.tencent.hpcflow.infrastructure.persistence.pipeline.entity.PipelineDO;
import org.apache.ibatis.annotations.Mapper;

/**
 * PipelineMapper - 流水线Mapper
 *
 * @author hpcflow
 */
@Mapper
public interface PipelineMapper extends BaseMapper<PipelineDO> {
}
