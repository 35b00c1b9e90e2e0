package com.echo.signaling_service.dto;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.echo.signaling_service.enums.CallKind;
import com.echo.signaling_service.enums.CallState;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

/**
 * One attempted or active call. Only the call orchestrator mutates it, and only while
 * holding its lock; membership and state reads are safe from any thread.
 */
@Getter
public class CallSession {

	private final String callId;
	private final CallScope scope;
	private final String initiator;
	private final long startedAt;

	@Setter
	private volatile CallKind kind;
	@Setter
	private volatile CallState state = CallState.INVITING;
	@Setter
	private volatile RingingEdge ringingEdge;

	private volatile Long endedAt;

	// current members, join order
	@Getter(AccessLevel.NONE)
	private final Set<String> participants = new LinkedHashSet<>();
	// everyone who ever joined, for the call log
	@Getter(AccessLevel.NONE)
	private final Set<String> joinedOnce = new LinkedHashSet<>();

	public CallSession(String callId, CallKind kind, CallScope scope, String initiator, long startedAt) {
		this.callId = callId;
		this.kind = kind;
		this.scope = scope;
		this.initiator = initiator;
		this.startedAt = startedAt;
	}

	public boolean isDirect() {
		return scope.isDirect();
	}

	/**
	 * @return true when this is the first participant the session ever had
	 */
	public synchronized boolean addParticipant(String connectionId) {
		boolean first = joinedOnce.isEmpty();
		participants.add(connectionId);
		joinedOnce.add(connectionId);
		return first;
	}

	public synchronized boolean removeParticipant(String connectionId) {
		return participants.remove(connectionId);
	}

	public synchronized boolean hasParticipant(String connectionId) {
		return participants.contains(connectionId);
	}

	/**
	 * Caller or callee of a one-to-one call, whatever its state.
	 */
	public boolean isParty(String connectionId) {
		return isDirect() && (initiator.equals(connectionId) || scope.getTarget().equals(connectionId));
	}

	public String peerOf(String connectionId) {
		if (!isDirect()) {
			return null;
		}
		return initiator.equals(connectionId) ? scope.getTarget() : initiator;
	}

	public synchronized int participantCount() {
		return participants.size();
	}

	public synchronized List<String> participantList() {
		return new ArrayList<>(participants);
	}

	public synchronized List<String> joinedOnceList() {
		return new ArrayList<>(joinedOnce);
	}

	public boolean isEnded() {
		return state == CallState.ENDED;
	}

	public void markEnded(long timestamp) {
		this.state = CallState.ENDED;
		this.endedAt = timestamp;
		if (ringingEdge != null) {
			ringingEdge.cancelTimeout();
			ringingEdge = null;
		}
	}
}
