package com.tencent.hpcflow.client.dto.request;

import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.List;

/**
 * 新的包顺序，必须是现有包的一个排列
 */
@Data
public class ReorderRequest {

    @NotEmpty
    private List<String> order;
}
