package com.echo.signaling_service.service;

import java.util.HashMap;
import java.util.Map;

import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

import com.echo.signaling_service.config.SignalingProperties;
import com.echo.signaling_service.constants.ApplicationConstants;
import com.echo.signaling_service.dto.NotificationMessage;
import com.echo.signaling_service.enums.CallKind;
import com.echo.signaling_service.enums.NotificationChannel;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Produces missed-call push notifications to Kafka for the notification consumer.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CallNotificationService {

    private final KafkaTemplate<String, NotificationMessage> kafkaTemplate;
    private final SignalingProperties properties;

    public void publishMissedCall(String calleeUserId, String callerName, String callId, CallKind kind,
            long timestamp) {
        if (!properties.isNotificationsEnabled()) {
            log.debug("Missed-call notification for {} skipped: notifications disabled", callId);
            return;
        }
        if (calleeUserId == null || calleeUserId.isEmpty()) {
            log.debug("Missed-call notification for {} skipped: callee has no userId", callId);
            return;
        }

        Map<String, String> map = new HashMap<>();
        map.put(ApplicationConstants.NOTIFICATION_MAP_CALL_ID, callId);
        map.put(ApplicationConstants.NOTIFICATION_MAP_CALLER_NAME, callerName);
        map.put(ApplicationConstants.NOTIFICATION_MAP_CALL_KIND, kind == null ? null : kind.getWireName());
        map.put(ApplicationConstants.NOTIFICATION_MAP_MESSAGE, "Missed call from " + callerName);

        NotificationMessage notification = NotificationMessage.builder()
                .userId(calleeUserId)
                .notificationId(ApplicationConstants.MISSED_CALL_NOTIFICATION_ID)
                .channel(NotificationChannel.PUSH)
                .map(map)
                .timestamp(timestamp)
                .build();

        try {
            kafkaTemplate.send(properties.getNotificationsTopic(), calleeUserId, notification)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            log.error("Failed to publish missed-call notification for {}: {}", callId, ex.getMessage());
                        } else {
                            log.info("Published missed-call notification for call {} to userId={}", callId, calleeUserId);
                        }
                    });
        } catch (Exception e) {
            log.error("Error publishing missed-call notification for {}: {}", callId, e.getMessage(), e);
        }
    }
}
