package com.echo.signaling_service.dto;

import java.util.concurrent.ScheduledFuture;

import com.echo.signaling_service.enums.CallKind;

import lombok.Getter;
import lombok.Setter;

/**
 * Caller to callee relation that lives between invite and accept/decline/end and drives
 * the unanswered-call timeout. Compared by identity: a timer only acts on the edge it was
 * scheduled for.
 */
@Getter
public class RingingEdge {

	private final String caller;
	private final String callee;
	private final CallKind kind;
	private final long startedAt;

	@Setter
	private ScheduledFuture<?> timeout;

	public RingingEdge(String caller, String callee, CallKind kind, long startedAt) {
		this.caller = caller;
		this.callee = callee;
		this.kind = kind;
		this.startedAt = startedAt;
	}

	public void cancelTimeout() {
		if (timeout != null) {
			timeout.cancel(false);
		}
	}
}
