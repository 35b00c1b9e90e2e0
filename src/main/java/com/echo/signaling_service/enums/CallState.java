package com.echo.signaling_service.enums;

/**
 * Lifecycle of a call session.
 *
 * One-to-one: INVITING -> RINGING -> ACTIVE -> ENDED.
 * Mesh: INVITING -> ACTIVE -> DRAINING -> ENDED, where each join/leave is its own edge.
 */
public enum CallState {
	INVITING,
	RINGING,
	ACTIVE,
	DRAINING,
	ENDED
}
