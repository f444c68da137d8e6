package com.example.publishing.worker.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.validator.constraints.time.DurationMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * 调度与投递配置
 *
 * 支持环境变量覆盖，例如 PUBLISHING_SCHEDULER_POLL_INTERVAL=30s、PUBLISHING_DISPATCH_BATCH_SIZE=20
 */
@Data
@Validated
@ConfigurationProperties(prefix = "publishing")
public class PublishingProperties {

    @Valid
    private Scheduler scheduler = new Scheduler();

    @Valid
    private Dispatch dispatch = new Dispatch();

    @Valid
    private Resolver resolver = new Resolver();

    @Valid
    private Delivery delivery = new Delivery();

    @Getter
    @Setter
    public static class Scheduler {

        /**
         * 是否随应用启动
         */
        private boolean enabled = true;

        /**
         * 轮询间隔
         */
        @NotNull
        @DurationMin(millis = 1)
        private Duration pollInterval = Duration.ofSeconds(60);

        /**
         * 停止时等待当前轮次完成的最长时间
         */
        @NotNull
        @DurationMin(millis = 0)
        private Duration shutdownTimeout = Duration.ofMinutes(5);
    }

    @Getter
    @Setter
    public static class Dispatch {

        @Min(1)
        private int batchSize = 10;

        @NotNull
        @DurationMin(millis = 0)
        private Duration interRecipientDelay = Duration.ofMillis(500);

        @NotNull
        @DurationMin(millis = 0)
        private Duration interBatchDelay = Duration.ofMillis(2000);
    }

    @Getter
    @Setter
    public static class Resolver {

        /**
         * 单次查询的最大行数，超出部分继续翻页
         */
        @Min(1)
        private int pageSize = 100;
    }

    @Getter
    @Setter
    public static class Delivery {

        /**
         * 邮件服务商的发送接口
         */
        @NotBlank
        private String endpoint = "http://localhost:8025/api/send";

        /**
         * 为空时不发送Authorization头
         */
        private String apiKey = "";

        @NotNull
        @DurationMin(millis = 1)
        private Duration connectTimeout = Duration.ofSeconds(5);

        @NotNull
        @DurationMin(millis = 1)
        private Duration readTimeout = Duration.ofSeconds(30);
    }
}
