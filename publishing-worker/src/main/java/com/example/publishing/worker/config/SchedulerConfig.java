package com.example.publishing.worker.config;

import com.example.publishing.worker.service.DispatchPacer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 调度器基础组件配置
 */
@Configuration
@EnableConfigurationProperties(PublishingProperties.class)
public class SchedulerConfig {

    /**
     * 统一使用UTC时钟，与存储中的时间戳保持一致
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public DispatchPacer dispatchPacer() {
        return DispatchPacer.sleeping();
    }
}
