package com.echo.signaling_service.enums;

public enum NotificationChannel {
	SMS,
	EMAIL,
	INAPP,
	PUSH
}
