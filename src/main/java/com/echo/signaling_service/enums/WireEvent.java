package com.echo.signaling_service.enums;

import java.util.HashMap;
import java.util.Map;

import com.echo.signaling_service.dto.CallInviteRequest;
import com.echo.signaling_service.dto.CallRefRequest;
import com.echo.signaling_service.dto.ChatMessageRequest;
import com.echo.signaling_service.dto.JoinRequest;
import com.echo.signaling_service.dto.JoinRoomRequest;
import com.echo.signaling_service.dto.SignalRequest;

/**
 * Inbound events accepted on the signaling channel, each bound to exactly one payload type.
 */
public enum WireEvent {

	JOIN("join", JoinRequest.class),
	JOIN_ROOM("joinRoom", JoinRoomRequest.class),
	LEAVE_ROOM("leaveRoom", Void.class),
	MESSAGE("message", ChatMessageRequest.class),
	WEBRTC_OFFER("webrtc:offer", SignalRequest.class),
	WEBRTC_ANSWER("webrtc:answer", SignalRequest.class),
	WEBRTC_ICE("webrtc:ice", SignalRequest.class),
	WEBRTC_END("webrtc:end", SignalRequest.class),
	CALL_INVITE("call:invite", CallInviteRequest.class),
	CALL_JOIN("call:join", CallRefRequest.class),
	CALL_LEAVE("call:leave", CallRefRequest.class),
	CALL_END_ALL("call:endAll", CallRefRequest.class),
	CALL_BUSY("call:busy", SignalRequest.class),
	CALL_UPGRADE("call:upgrade", SignalRequest.class),
	CALL_UPGRADE_RESPONSE("call:upgrade:response", SignalRequest.class);

	private static final Map<String, WireEvent> BY_NAME = new HashMap<>();

	static {
		for (WireEvent event : values()) {
			BY_NAME.put(event.wireName, event);
		}
	}

	private final String wireName;
	private final Class<?> payloadType;

	WireEvent(String wireName, Class<?> payloadType) {
		this.wireName = wireName;
		this.payloadType = payloadType;
	}

	public String getWireName() {
		return wireName;
	}

	public Class<?> getPayloadType() {
		return payloadType;
	}

	public static WireEvent fromWire(String name) {
		return name == null ? null : BY_NAME.get(name);
	}
}
