package com.echo.signaling_service.dto;

import lombok.Value;

@Value
public class DeliveryReceipt {
	long timestamp;
	String room;
	int recipients;
	boolean persisted;
}
