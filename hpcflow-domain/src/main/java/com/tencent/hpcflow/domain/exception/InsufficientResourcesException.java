package com.tencent.hpcflow.domain.exception;

import lombok.Getter;

/**
 * InsufficientResourcesException - 调度器无法放置某个包
 * <p>
 * 总是指明无法满足的包以及缺口。
 * </p>
 */
@Getter
public class InsufficientResourcesException extends HpcflowException {

    private final String packageName;

    private final String shortfall;

    public InsufficientResourcesException(String packageName, String shortfall) {
        super(ErrorCode.INSUFFICIENT_RESOURCES, "package:" + packageName,
                "Cannot place package '" + packageName + "': " + shortfall);
        this.packageName = packageName;
        this.shortfall = shortfall;
    }
}
