package com.echo.signaling_service.dto;

import com.echo.signaling_service.enums.CallKind;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.databind.JsonNode;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Routing fields of a peer-to-peer signaling event. {@code sdp} and {@code candidate}
 * are relayed verbatim and never inspected.
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class SignalRequest {

	private String to;
	private String callId;

	@JsonAlias("media")
	private CallKind kind;

	private JsonNode sdp;
	private JsonNode candidate;

	private Boolean accepted;   // call:upgrade:response only
}
