package com.echo.signaling_service.dto;

import lombok.Value;

/**
 * One event addressed to one connection, queued while registry locks are held and
 * delivered after they are released.
 */
@Value
public class OutboundSignal {
	String connectionId;
	String event;
	Object payload;
}
