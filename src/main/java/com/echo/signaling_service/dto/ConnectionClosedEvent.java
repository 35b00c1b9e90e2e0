package com.echo.signaling_service.dto;

import lombok.Value;

/**
 * Published synchronously while a connection is being torn down, before its identity is
 * released. Listeners run to completion inside {@code unregister}.
 */
@Value
public class ConnectionClosedEvent {
	String connectionId;
	Identity identity;
}
