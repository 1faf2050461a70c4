package com.tencent.hpcflow.client.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ImportDescriptorRequest {

    /**
     * YAML 描述文件内容
     */
    @NotBlank
    private String content;

    /**
     * 同名流水线存在时是否覆盖
     */
    private boolean replace;
}
