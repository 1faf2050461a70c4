package com.tencent.hpcflow.domain.checkpoint;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * CheckpointSettings - 检查点参数
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckpointSettings {

    /**
     * 每个执行保留的检查点数量，至少为 1
     */
    @Builder.Default
    private int retention = 5;

    /**
     * 执行失败或停止时是否自动保存最终进度
     */
    @Builder.Default
    private boolean checkpointOnTermination = true;
}
