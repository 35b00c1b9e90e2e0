package com.echo.signaling_service.service;

import java.util.List;

import com.echo.signaling_service.dto.OutboundSignal;

/**
 * Fire-and-forget delivery of events to connections. Unknown or closed connections are
 * skipped; delivery never throws.
 */
public interface SignalDispatcher {

	void send(String connectionId, String event, Object payload);

	default void sendAll(List<OutboundSignal> signals) {
		for (OutboundSignal signal : signals) {
			send(signal.getConnectionId(), signal.getEvent(), signal.getPayload());
		}
	}
}
