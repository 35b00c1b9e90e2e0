package com.echo.signaling_service.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConnectedUser {

	private String id;       // connection id
	private String name;
	private String userId;   // optional stable id

	public static ConnectedUser of(String connectionId, Identity identity) {
		return new ConnectedUser(connectionId, identity.getName(), identity.getUserId());
	}
}
