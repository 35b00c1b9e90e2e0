package com.echo.signaling_service.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CallScopeType {
	DIRECT,
	ROOM,
	GLOBAL;

	@JsonValue
	public String wireName() {
		return name().toLowerCase();
	}
}
