package com.alertengine.api.controller;

import com.alertengine.api.dto.request.TestChannelRequest;
import com.alertengine.domain.model.NotificationChannel;
import com.alertengine.mapper.AlertDtoMapper;
import com.alertengine.notification.NotificationDispatcher;
import jakarta.validation.Valid;
import java.util.Map;
import org.mapstruct.factory.Mappers;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for notification test endpoints.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/notifications/test} -- send a test notification through the given channel</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/notifications")
public class NotificationController {

    private final NotificationDispatcher notificationDispatcher;
    private final AlertDtoMapper alertDtoMapper = Mappers.getMapper(AlertDtoMapper.class);

    public NotificationController(NotificationDispatcher notificationDispatcher) {
        this.notificationDispatcher = notificationDispatcher;
    }

    @PostMapping("/test")
    public Map<String, Object> testChannel(@Valid @RequestBody TestChannelRequest request) {
        NotificationChannel channel = alertDtoMapper.toDomain(request);
        boolean delivered = notificationDispatcher.testChannel(channel);
        return Map.of("channel", channel.getType(), "delivered", delivered);
    }
}
