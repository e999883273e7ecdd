package com.example.tracking.config;

import com.example.tracking.tracker.MultiObjectTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 跟踪器配置校验和初始化
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class TrackingConfiguration {

    private final TrackingProperties trackingProperties;

    /**
     * 启动时校验默认参数，非法配置直接使启动失败
     */
    @Bean
    public CommandLineRunner trackingSetup() {
        return args -> {
            log.info("初始化多目标跟踪...");

            new MultiObjectTracker(trackingProperties.toSettings());

            log.info("跟踪系统初始化完成: maxAge={}, minHits={}, iouThreshold={}",
                    trackingProperties.getMaxAge(),
                    trackingProperties.getMinHits(),
                    trackingProperties.getIouThreshold());
        };
    }
}
