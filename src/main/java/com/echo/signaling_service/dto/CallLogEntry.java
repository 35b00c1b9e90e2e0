package com.echo.signaling_service.dto;

import java.util.List;

import com.echo.signaling_service.enums.CallKind;
import com.echo.signaling_service.enums.CallOutcome;
import com.echo.signaling_service.enums.CallScopeType;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable snapshot of a call, taken at creation and replaced on every recorded change.
 * {@code endedAt} and {@code outcome} stay null while the call is in progress.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CallLogEntry {

	String callId;
	CallKind kind;
	CallScopeType scope;
	String room;
	String initiator;
	String target;
	List<String> participants;
	long startedAt;
	Long endedAt;
	CallOutcome outcome;

	public static CallLogEntry of(CallSession session) {
		return CallLogEntry.builder()
				.callId(session.getCallId())
				.kind(session.getKind())
				.scope(session.getScope().getType())
				.room(session.getScope().getRoom())
				.target(session.getScope().getTarget())
				.initiator(session.getInitiator())
				.participants(List.copyOf(session.joinedOnceList()))
				.startedAt(session.getStartedAt())
				.endedAt(session.getEndedAt())
				.build();
	}

	@JsonIgnore
	public boolean isFinal() {
		return endedAt != null;
	}
}
