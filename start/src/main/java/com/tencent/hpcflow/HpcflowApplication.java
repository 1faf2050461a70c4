package com.tencent.hpcflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Hpcflow Application Entry Point
 *
 * @author hpcflow
 */
@SpringBootApplication(scanBasePackages = "com.tencent.hpcflow")
@ConfigurationPropertiesScan("com.tencent.hpcflow.config")
public class HpcflowApplication {

    public static void main(String[] args) {
        SpringApplication.run(HpcflowApplication.class, args);
    }
}
