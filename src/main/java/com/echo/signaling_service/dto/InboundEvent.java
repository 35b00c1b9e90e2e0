package com.echo.signaling_service.dto;

import com.echo.signaling_service.enums.WireEvent;

import lombok.Value;

/**
 * A decoded inbound frame: the event and its typed payload (null for payload-less events).
 */
@Value
public class InboundEvent {
	WireEvent event;
	Object payload;

	public <T> T payloadAs(Class<T> type) {
		return type.cast(payload);
	}
}
