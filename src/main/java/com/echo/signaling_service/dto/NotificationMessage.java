package com.echo.signaling_service.dto;

import java.util.Map;

import com.echo.signaling_service.enums.NotificationChannel;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Push notification event published to Kafka for the notification consumer.
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NotificationMessage {

	private String userId;               // stable id of the recipient
	private Long notificationId;
	private NotificationChannel channel;
	private Map<String, String> map;
	private Long timestamp;
}
