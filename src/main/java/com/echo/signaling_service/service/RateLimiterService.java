package com.echo.signaling_service.service;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import lombok.extern.slf4j.Slf4j;

/**
 * Fixed-window request counter per key. The first request after a window has elapsed
 * opens a new window.
 */
@Slf4j
@Service
public class RateLimiterService {

    private static final long MAX_IDLE_MS = 10 * 60_000L;

    private final Map<String, Window> windows = new ConcurrentHashMap<>();
    private final Clock clock;

    public RateLimiterService(Clock clock) {
        this.clock = clock;
    }

    public boolean allow(String key, int limit, long windowMs) {
        long now = clock.millis();
        boolean[] allowed = new boolean[1];
        windows.compute(key, (k, window) -> {
            if (window == null || now - window.start > windowMs) {
                allowed[0] = limit > 0;
                return new Window(now, 1);
            }
            if (window.count >= limit) {
                return window;
            }
            window.count++;
            allowed[0] = true;
            return window;
        });
        if (!allowed[0]) {
            log.debug("Rate limit hit for key '{}'", key);
        }
        return allowed[0];
    }

    /**
     * Milliseconds until the window of {@code key} reopens; 0 when it is open.
     */
    public long retryAfterMs(String key, int limit, long windowMs) {
        Window window = windows.get(key);
        if (window == null) {
            return 0L;
        }
        long remaining = window.start + windowMs - clock.millis();
        return window.count >= limit && remaining > 0 ? remaining : 0L;
    }

    @Scheduled(fixedDelay = MAX_IDLE_MS)
    public void evictIdleWindows() {
        long now = clock.millis();
        int before = windows.size();
        windows.values().removeIf(window -> now - window.start > MAX_IDLE_MS);
        if (before != windows.size()) {
            log.debug("Evicted {} idle rate limit window(s)", before - windows.size());
        }
    }

    private static final class Window {
        private final long start;
        private int count;

        private Window(long start, int count) {
            this.start = start;
            this.count = count;
        }
    }
}
