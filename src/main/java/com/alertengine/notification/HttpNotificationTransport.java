package com.alertengine.notification;

import com.alertengine.exception.NotificationDeliveryException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Posts notifications as JSON over HTTP.
 */
@Component
public class HttpNotificationTransport implements NotificationTransport {

    private static final Logger log = LoggerFactory.getLogger(HttpNotificationTransport.class);

    private final RestTemplate restTemplate;

    public HttpNotificationTransport(@Qualifier("notificationRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public void send(OutboundNotification notification) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        notification.getHeaders().forEach(headers::set);
        HttpEntity<Map<String, Object>> request = new HttpEntity<>(notification.getPayload(), headers);

        ResponseEntity<String> response;
        try {
            response = restTemplate.postForEntity(notification.getUrl(), request, String.class);
        } catch (RestClientException e) {
            throw new NotificationDeliveryException(
                    notification.getChannelType(), "HTTP request failed: " + e.getMessage(), e);
        }

        if (!response.getStatusCode().is2xxSuccessful()) {
            throw new NotificationDeliveryException(
                    notification.getChannelType(), "HTTP request failed: " + response.getStatusCode());
        }
        log.debug("{} notification posted to {}", notification.getChannelType(), notification.getUrl());
    }
}
