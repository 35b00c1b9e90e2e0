package com.echo.signaling_service.dto;

import lombok.Value;

/**
 * Display name plus the optional stable cross-session user id.
 */
@Value
public class Identity {
	String name;
	String userId;
}
