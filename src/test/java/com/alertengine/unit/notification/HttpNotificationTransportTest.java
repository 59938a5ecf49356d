package com.alertengine.unit.notification;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.alertengine.domain.enums.NotificationChannelType;
import com.alertengine.exception.NotificationDeliveryException;
import com.alertengine.notification.HttpNotificationTransport;
import com.alertengine.notification.OutboundNotification;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

class HttpNotificationTransportTest {

    private MockRestServiceServer server;
    private HttpNotificationTransport transport;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        transport = new HttpNotificationTransport(restTemplate);
    }

    private static OutboundNotification webhook() {
        return OutboundNotification.builder()
                .channelType(NotificationChannelType.WEBHOOK)
                .url("https://hook.example/in")
                .payload(Map.of("type", "alert"))
                .headers(Map.of("X-Api-Key", "secret"))
                .build();
    }

    @Test
    void send_postsJsonWithExtraHeaders() {
        server.expect(requestTo("https://hook.example/in"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("X-Api-Key", "secret"))
                .andExpect(content().json("{\"type\":\"alert\"}"))
                .andRespond(withSuccess());

        assertThatCode(() -> transport.send(webhook())).doesNotThrowAnyException();
        server.verify();
    }

    @Test
    void send_serverError_throwsDeliveryException() {
        server.expect(requestTo("https://hook.example/in")).andRespond(withServerError());

        assertThatThrownBy(() -> transport.send(webhook()))
                .isInstanceOf(NotificationDeliveryException.class)
                .hasMessageContaining("HTTP request failed");
    }
}
