package com.echo.signaling_service.dto;

import com.echo.signaling_service.enums.CallKind;
import com.fasterxml.jackson.annotation.JsonAlias;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class CallInviteRequest {

	private String callId;

	@JsonAlias("type")
	private CallKind kind;

	private String room;   // group scope; null with no target means global
	private String to;     // one-to-one target connection
}
