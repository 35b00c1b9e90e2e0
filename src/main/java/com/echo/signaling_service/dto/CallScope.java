package com.echo.signaling_service.dto;

import com.echo.signaling_service.enums.CallScopeType;

import lombok.Value;

/**
 * Either a single target connection (one-to-one) or a room/global audience (mesh).
 */
@Value
public class CallScope {

	CallScopeType type;
	String room;
	String target;

	public static CallScope direct(String target) {
		return new CallScope(CallScopeType.DIRECT, null, target);
	}

	public static CallScope group(String room) {
		return room == null ? new CallScope(CallScopeType.GLOBAL, null, null)
				: new CallScope(CallScopeType.ROOM, room, null);
	}

	public boolean isDirect() {
		return type == CallScopeType.DIRECT;
	}
}
