package com.example.publishing.worker.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

/**
 * 投递通道使用的RestTemplate配置
 *
 * 超时取自 publishing.delivery.*，对单个收件人的一次请求生效
 */
@Configuration
public class RestTemplateConfig {

    @Bean
    public RestTemplate deliveryRestTemplate(PublishingProperties properties) {
        PublishingProperties.Delivery delivery = properties.getDelivery();

        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(delivery.getConnectTimeout());
        factory.setReadTimeout(delivery.getReadTimeout());
        return new RestTemplate(factory);
    }
}
