package com.echo.signaling_service.repo;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

import org.apache.commons.lang.exception.ExceptionUtils;

import com.echo.signaling_service.dto.ChatMessage;
import com.echo.signaling_service.dto.Contact;

import lombok.extern.slf4j.Slf4j;

/**
 * Uses the primary store while it works and the in-memory store whenever it throws.
 * The primary is retried on every call, so the store recovers on its own.
 */
@Slf4j
public class FallbackChatStore implements ChatStore {

	private final ChatStore primary;
	private final ChatStore fallback;
	private final AtomicBoolean degraded = new AtomicBoolean(false);

	public FallbackChatStore(ChatStore primary, ChatStore fallback) {
		this.primary = primary;
		this.fallback = fallback;
	}

	@Override
	public void appendMessage(String name, String text, long ts, String room) {
		run("appendMessage", () -> primary.appendMessage(name, text, ts, room),
				() -> fallback.appendMessage(name, text, ts, room));
	}

	@Override
	public List<ChatMessage> queryMessages(String room, int limit) {
		return call("queryMessages", () -> primary.queryMessages(room, limit),
				() -> fallback.queryMessages(room, limit));
	}

	@Override
	public void upsertContact(String ownerId, String name, String contactId) {
		run("upsertContact", () -> primary.upsertContact(ownerId, name, contactId),
				() -> fallback.upsertContact(ownerId, name, contactId));
	}

	@Override
	public List<Contact> listContacts(String ownerId) {
		return call("listContacts", () -> primary.listContacts(ownerId), () -> fallback.listContacts(ownerId));
	}

	@Override
	public boolean deleteContact(String ownerId, String name, String contactId) {
		return call("deleteContact", () -> primary.deleteContact(ownerId, name, contactId),
				() -> fallback.deleteContact(ownerId, name, contactId));
	}

	public boolean isDegraded() {
		return degraded.get();
	}

	private void run(String operation, Runnable onPrimary, Runnable onFallback) {
		call(operation, () -> {
			onPrimary.run();
			return null;
		}, () -> {
			onFallback.run();
			return null;
		});
	}

	private <T> T call(String operation, Supplier<T> onPrimary, Supplier<T> onFallback) {
		try {
			T result = onPrimary.get();
			if (degraded.compareAndSet(true, false)) {
				log.info("Primary chat store reachable again (operation={})", operation);
			}
			return result;
		} catch (RuntimeException e) {
			if (degraded.compareAndSet(false, true)) {
				log.error("Primary chat store unavailable, using in-memory fallback: {}",
						ExceptionUtils.getRootCauseMessage(e));
			} else {
				log.debug("Primary chat store still unavailable for {}: {}", operation, e.getMessage());
			}
			return onFallback.get();
		}
	}
}
