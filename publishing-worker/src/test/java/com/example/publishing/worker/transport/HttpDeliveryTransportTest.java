package com.example.publishing.worker.transport;

import com.example.publishing.common.entity.NotificationPayload;
import com.example.publishing.common.entity.Recipient;
import com.example.publishing.worker.config.PublishingProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

/**
 * HTTP投递通道测试
 */
class HttpDeliveryTransportTest {

    private static final String ENDPOINT = "http://mail.test/api/send";

    private MockRestServiceServer server;
    private HttpDeliveryTransport transport;
    private final NotificationPayload payload = NotificationPayload.builder()
        .subject("新文章发布")
        .body("<p>hello</p>")
        .build();

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        PublishingProperties properties = new PublishingProperties();
        properties.getDelivery().setEndpoint(ENDPOINT);
        properties.getDelivery().setApiKey("secret");
        transport = new HttpDeliveryTransport(restTemplate, properties);
    }

    @Test
    void postsOneMessagePerRecipient() throws DeliveryException {
        server.expect(requestTo(ENDPOINT))
            .andExpect(method(HttpMethod.POST))
            .andExpect(header("Authorization", "Bearer secret"))
            .andExpect(jsonPath("$.to").value("reader@example.com"))
            .andExpect(jsonPath("$.subject").value("新文章发布"))
            .andExpect(jsonPath("$.html").value("<p>hello</p>"))
            .andRespond(withSuccess("{\"id\":\"m-1\"}", MediaType.APPLICATION_JSON));

        transport.deliver(Recipient.of("reader@example.com"), payload);

        server.verify();
    }

    @Test
    void errorStatusBecomesDeliveryException() {
        server.expect(requestTo(ENDPOINT))
            .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS).body("rate limited"));

        DeliveryException e = assertThrows(DeliveryException.class,
            () -> transport.deliver(Recipient.of("reader@example.com"), payload));

        assertEquals(Integer.valueOf(429), e.getHttpStatus());
        assertTrue(e.getMessage().contains("rate limited"));
    }

    @Test
    void blankApiKeySendsNoAuthorizationHeader() throws DeliveryException {
        RestTemplate restTemplate = new RestTemplate();
        MockRestServiceServer anonymousServer = MockRestServiceServer.bindTo(restTemplate).build();
        PublishingProperties properties = new PublishingProperties();
        properties.getDelivery().setEndpoint(ENDPOINT);
        HttpDeliveryTransport anonymous = new HttpDeliveryTransport(restTemplate, properties);

        anonymousServer.expect(requestTo(ENDPOINT))
            .andExpect(headerDoesNotExist("Authorization"))
            .andRespond(withSuccess());

        anonymous.deliver(Recipient.of("reader@example.com"), payload);

        anonymousServer.verify();
    }

    @Test
    void blankRecipientIsRejectedWithoutRequest() {
        assertThrows(DeliveryException.class, () -> transport.deliver(Recipient.of(" "), payload));

        server.verify();
    }
}
