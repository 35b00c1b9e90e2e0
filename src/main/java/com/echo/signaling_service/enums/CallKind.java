package com.echo.signaling_service.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum CallKind {

	AUDIO("audio"),
	VIDEO("video");

	private final String wireName;

	CallKind(String wireName) {
		this.wireName = wireName;
	}

	@JsonValue
	public String getWireName() {
		return wireName;
	}

	/**
	 * Unknown values are rejected so the payload is dropped at the boundary.
	 */
	@JsonCreator
	public static CallKind fromWire(String value) {
		if (value == null) {
			return null;
		}
		for (CallKind kind : values()) {
			if (kind.wireName.equalsIgnoreCase(value.trim())) {
				return kind;
			}
		}
		throw new IllegalArgumentException("Unknown call kind: " + value);
	}
}
