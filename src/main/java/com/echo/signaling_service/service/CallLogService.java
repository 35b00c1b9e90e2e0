package com.echo.signaling_service.service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.echo.signaling_service.config.SignalingProperties;
import com.echo.signaling_service.dto.CallLogEntry;
import com.echo.signaling_service.enums.CallOutcome;

import lombok.extern.slf4j.Slf4j;

/**
 * Bounded, insertion-ordered history of calls. When full, the oldest entry is evicted.
 * A reused call id starts a fresh entry; the earlier one stays until evicted.
 */
@Slf4j
@Service
public class CallLogService {

    private final int capacity;
    private long sequence;
    // sequence -> entry, oldest first
    private final LinkedHashMap<Long, CallLogEntry> entries = new LinkedHashMap<>();
    // callId -> sequence of its newest entry
    private final Map<String, Long> latestByCallId = new HashMap<>();

    public CallLogService(SignalingProperties properties) {
        this.capacity = Math.max(1, properties.getCallLogCapacity());
    }

    public synchronized void record(CallLogEntry entry) {
        long seq = ++sequence;
        entries.put(seq, entry);
        latestByCallId.put(entry.getCallId(), seq);

        Iterator<Map.Entry<Long, CallLogEntry>> oldest = entries.entrySet().iterator();
        while (entries.size() > capacity && oldest.hasNext()) {
            Map.Entry<Long, CallLogEntry> evicted = oldest.next();
            oldest.remove();
            latestByCallId.remove(evicted.getValue().getCallId(), evicted.getKey());
            log.debug("Evicted call log entry {}", evicted.getValue().getCallId());
        }
    }

    /**
     * Replaces the newest entry for the call, keeping its position. Entries already
     * finalized or evicted are left alone.
     */
    public synchronized void update(CallLogEntry snapshot) {
        Long seq = latestByCallId.get(snapshot.getCallId());
        if (seq == null) {
            log.debug("update: no call log entry for {}", snapshot.getCallId());
            return;
        }
        if (entries.get(seq).isFinal()) {
            return;
        }
        entries.put(seq, snapshot);
    }

    /**
     * Stamps end time and outcome on the newest entry of the call. Idempotent: a call is
     * finalized once.
     */
    public synchronized void finalizeEntry(String callId, long endedAt, CallOutcome outcome) {
        Long seq = latestByCallId.get(callId);
        if (seq == null) {
            log.debug("finalizeEntry: no call log entry for {}", callId);
            return;
        }
        CallLogEntry current = entries.get(seq);
        if (current.isFinal()) {
            return;
        }
        entries.put(seq, current.toBuilder().endedAt(endedAt).outcome(outcome).build());
        log.info("CALL {} finalized as {}", callId, outcome);
    }

    /**
     * The {@code n} newest entries, oldest of them first.
     */
    public synchronized List<CallLogEntry> recent(int n) {
        List<CallLogEntry> all = new ArrayList<>(entries.values());
        if (n <= 0) {
            return new ArrayList<>();
        }
        return all.size() <= n ? all : new ArrayList<>(all.subList(all.size() - n, all.size()));
    }

    public synchronized Optional<CallLogEntry> find(String callId) {
        Long seq = latestByCallId.get(callId);
        return seq == null ? Optional.empty() : Optional.of(entries.get(seq));
    }

    public synchronized int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }
}
