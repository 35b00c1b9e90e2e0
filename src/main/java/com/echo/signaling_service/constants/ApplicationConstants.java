package com.echo.signaling_service.constants;

public class ApplicationConstants {

	// HTTP routes
	public static final String AUTH = "/auth";
	public static final String LOGIN = "/login";
	public static final String CONTACTS = "/contacts";
	public static final String CALLS = "/calls";
	public static final String MESSAGES = "/messages";
	public static final String PRESENCE = "/presence";
	public static final String USERS = "/users";
	public static final String WEBSOCKET_PATH = "/ws";

	public static final String BEARER_PREFIX = "Bearer ";
	public static final String TOKEN_QUERY_PARAM = "token";
	public static final String SESSION_ATTR_USER_ID = "authenticatedUserId";
	public static final String PING_FRAME_MARKER = "\"type\":\"ping\"";
	public static final String PONG_FRAME = "{\"type\":\"pong\"}";
	public static final String DEFAULT_DISPLAY_NAME = "Anonymous";
	public static final String GLOBAL_ROOM_ALIAS = "global";

	// Outbound wire events
	public static final String EVENT_USER_JOIN = "user:join";
	public static final String EVENT_USER_LEAVE = "user:leave";
	public static final String EVENT_USERS = "users";
	public static final String EVENT_USERS_IN_ROOM = "usersInRoom";
	public static final String EVENT_ROOM_JOIN = "room:join";
	public static final String EVENT_ROOM_LEAVE = "room:leave";
	public static final String EVENT_MESSAGE = "message";
	public static final String EVENT_WEBRTC_OFFER = "webrtc:offer";
	public static final String EVENT_WEBRTC_ANSWER = "webrtc:answer";
	public static final String EVENT_WEBRTC_ICE = "webrtc:ice";
	public static final String EVENT_WEBRTC_END = "webrtc:end";
	public static final String EVENT_CALL_INVITE = "call:invite";
	public static final String EVENT_CALL_PARTICIPANTS = "call:participants";
	public static final String EVENT_CALL_END_ALL = "call:endAll";
	public static final String EVENT_CALL_BUSY = "call:busy";
	public static final String EVENT_CALL_MISSED = "call:missed";
	public static final String EVENT_CALL_UPGRADE = "call:upgrade";
	public static final String EVENT_CALL_UPGRADE_RESPONSE = "call:upgrade:response";

	// Shared presence sets
	public static final String PRESENCE_GLOBAL_KEY = "presence:global";
	public static final String PRESENCE_USERS_KEY = "presence:users";
	public static final String PRESENCE_ROOM_KEY_PREFIX = "presence:";

	// Chat store keys
	public static final String CHAT_ROOM_MESSAGES_KEY_PREFIX = "chat:messages:room:";
	public static final String CHAT_TIMELINE_KEY = "chat:messages:all";
	public static final String CONTACTS_KEY_PREFIX = "contacts:";

	// Rate limiter operation classes
	public static final String RATE_OP_CONTACTS_GET = "get";
	public static final String RATE_OP_CONTACTS_POST = "post";
	public static final String RATE_OP_CONTACTS_DELETE = "del";

	// Notifications
	public static final Long MISSED_CALL_NOTIFICATION_ID = 3001L;
	public static final String NOTIFICATION_MAP_CALL_ID = "callId";
	public static final String NOTIFICATION_MAP_CALLER_NAME = "callerName";
	public static final String NOTIFICATION_MAP_CALL_KIND = "callKind";
	public static final String NOTIFICATION_MAP_MESSAGE = "message";

	public static final String TOKEN_CACHE = "verifiedTokens";

}
