package com.tencent.hpcflow.client.dto.request;

import lombok.Data;

@Data
public class CleanRequest {

    /**
     * light、standard 或 deep，缺省 standard
     */
    private String level;

    private boolean preserveLogs;

    private boolean preserveOutputs;
}
