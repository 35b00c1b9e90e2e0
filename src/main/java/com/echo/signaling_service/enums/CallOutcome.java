package com.echo.signaling_service.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CallOutcome {
	COMPLETED,
	MISSED,
	DECLINED,
	CANCELED,
	BUSY,
	TERMINATED;

	@JsonValue
	public String wireName() {
		return name().toLowerCase();
	}
}
