package com.example.publishing.worker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * 定时发布服务入口
 *
 * 按固定间隔发布到期内容，并限速投递到期通知
 */
@SpringBootApplication(scanBasePackages = "com.example.publishing")
@EntityScan("com.example.publishing.common.entity")
@EnableJpaRepositories("com.example.publishing.common.repository")
public class PublishingWorkerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PublishingWorkerApplication.class, args);
    }
}
