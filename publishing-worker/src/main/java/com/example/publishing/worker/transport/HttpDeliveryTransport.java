package com.example.publishing.worker.transport;

import com.example.publishing.common.entity.NotificationPayload;
import com.example.publishing.common.entity.Recipient;
import com.example.publishing.worker.config.PublishingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.Map;

/**
 * 基于HTTP的投递通道
 *
 * 每个收件人向邮件服务商接口发送一次POST请求，2xx视为成功
 */
@Slf4j
@Component
@Profile("!mock")
public class HttpDeliveryTransport implements DeliveryTransport {

    private final RestTemplate restTemplate;
    private final String endpoint;
    private final String apiKey;

    public HttpDeliveryTransport(RestTemplate deliveryRestTemplate, PublishingProperties properties) {
        this.restTemplate = deliveryRestTemplate;
        this.endpoint = properties.getDelivery().getEndpoint();
        this.apiKey = properties.getDelivery().getApiKey();
    }

    @Override
    public void deliver(Recipient recipient, NotificationPayload payload) throws DeliveryException {
        if (recipient == null || recipient.getEmail() == null || recipient.getEmail().isBlank()) {
            throw new DeliveryException("收件人地址为空");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (apiKey != null && !apiKey.isBlank()) {
            headers.setBearerAuth(apiKey);
        }

        HttpEntity<Map<String, Object>> requestEntity = new HttpEntity<>(buildBody(recipient, payload), headers);

        try {
            ResponseEntity<String> response = restTemplate.postForEntity(endpoint, requestEntity, String.class);
            if (!response.getStatusCode().is2xxSuccessful()) {
                throw new DeliveryException("HTTP " + response.getStatusCode().value() + ": " + response.getBody(),
                    response.getStatusCode().value(), null);
            }
            log.debug("投递成功: to={}, httpStatus={}", recipient.getEmail(), response.getStatusCode().value());

        } catch (HttpStatusCodeException e) {
            throw new DeliveryException("HTTP " + e.getStatusCode().value() + ": " + e.getResponseBodyAsString(),
                e.getStatusCode().value(), e);

        } catch (ResourceAccessException e) {
            throw new DeliveryException("网络错误: " + e.getMessage(), null, e);

        } catch (RestClientException e) {
            throw new DeliveryException("请求异常: " + e.getMessage(), null, e);
        }
    }

    private Map<String, Object> buildBody(Recipient recipient, NotificationPayload payload) {
        Map<String, Object> body = new HashMap<>();
        body.put("to", recipient.getEmail());
        body.put("subject", payload != null ? payload.getSubject() : null);
        body.put("html", payload != null ? payload.getBody() : null);
        if (recipient.getMetadata() != null) {
            body.put("metadata", recipient.getMetadata());
        }
        return body;
    }
}
