package com.echo.signaling_service.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

/**
 * Tunables of the signaling core. All values are externalized in application.properties.
 */
@Data
@Component
@ConfigurationProperties(prefix = "signaling")
public class SignalingProperties {

    /**
     * How long a one-to-one call may ring before it is finalized as missed.
     *
     * Default: 30000 ms
     */
    private long ringTimeoutMs = 30_000L;

    /**
     * Number of call log entries retained; the oldest are evicted first.
     */
    private int callLogCapacity = 500;

    /**
     * Upper bound for GET /messages and the default when no limit is given.
     */
    private int messageHistoryLimit = 200;

    /**
     * Chat messages longer than this are rejected at the boundary.
     */
    private int maxMessageLength = 4000;

    /**
     * Messages retained by the in-memory chat store.
     */
    private int inMemoryMessageCap = 500;

    /**
     * Messages retained per Redis list (room partitions and the global timeline).
     */
    private int redisMessageCap = 1000;

    /**
     * Requests allowed per key and window on the contacts endpoints.
     */
    private int rateLimit = 60;

    private long rateWindowMs = 60_000L;

    /**
     * Backend of the shared presence sets: redis or memory.
     */
    private String presenceStore = "redis";

    /**
     * Backend of the chat/contacts store: redis (with in-memory fallback) or memory.
     */
    private String store = "redis";

    /**
     * Reject WebSocket connections that do not carry a token query parameter.
     */
    private boolean requireToken = false;

    /**
     * Publish missed-call push notifications to Kafka.
     */
    private boolean notificationsEnabled = false;

    private String notificationsTopic = "notification-events";

    /**
     * Interval of the sweep that releases connections whose transport closed silently.
     */
    private long staleSweepIntervalMs = 60_000L;
}
