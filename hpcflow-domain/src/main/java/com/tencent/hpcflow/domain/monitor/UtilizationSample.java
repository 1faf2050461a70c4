package com.tencent.hpcflow.domain.monitor;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * UtilizationSample - 一次心跳采样
 * <p>
 * cpu 与 memory 为 0~100 的百分比，io 为 MB/s。
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UtilizationSample {

    private Instant at;

    private double cpu;

    private double memory;

    private double io;
}
