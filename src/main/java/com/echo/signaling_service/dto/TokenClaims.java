package com.echo.signaling_service.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class TokenClaims {

	private String sub;
	private long exp;   // epoch seconds

	public boolean isExpired(long nowEpochSeconds) {
		return exp < nowEpochSeconds;
	}
}
