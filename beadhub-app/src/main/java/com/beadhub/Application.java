package com.beadhub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * BeadHub 协调服务启动类。
 * <p>
 * 位于顶层包路径，确保能够扫描到 domain、infrastructure、trigger 各模块中的组件。
 * </p>
 *
 * @author beadhub
 * @since 2026-01-12
 */
@SpringBootApplication
@EnableScheduling
public class Application {

    public static void main(String[] args) {
        SpringApplication.run(Application.class, args);
    }

}
