package com.echo.signaling_service.repo;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

import com.echo.signaling_service.dto.ChatMessage;
import com.echo.signaling_service.dto.Contact;

import lombok.extern.slf4j.Slf4j;

/**
 * Degraded store used when no external backend is configured or reachable.
 */
@Slf4j
public class InMemoryChatStore implements ChatStore {

	private final int messageCap;
	private final Deque<ChatMessage> messages = new ArrayDeque<>();
	// ownerId -> storage key -> contact
	private final Map<String, Map<String, Contact>> contacts = new ConcurrentHashMap<>();

	public InMemoryChatStore(int messageCap) {
		this.messageCap = messageCap;
	}

	@Override
	public void appendMessage(String name, String text, long ts, String room) {
		ChatMessage message = ChatMessage.builder().name(name).text(text).ts(ts).room(room).build();
		synchronized (messages) {
			messages.addLast(message);
			while (messages.size() > messageCap) {
				messages.removeFirst();
			}
		}
	}

	@Override
	public List<ChatMessage> queryMessages(String room, int limit) {
		List<ChatMessage> filtered = new ArrayList<>();
		synchronized (messages) {
			for (ChatMessage m : messages) {
				if (room == null || room.equals(m.getRoom())) {
					filtered.add(m);
				}
			}
		}
		filtered.sort(Comparator.comparingLong(ChatMessage::getTs));
		int from = Math.max(0, filtered.size() - Math.max(0, limit));
		return new ArrayList<>(filtered.subList(from, filtered.size()));
	}

	@Override
	public void upsertContact(String ownerId, String name, String contactId) {
		Map<String, Contact> owned = contacts.computeIfAbsent(ownerId, k -> new LinkedHashMap<>());
		synchronized (owned) {
			String key = Contact.storageKey(name, contactId);
			Contact existing = owned.get(key);
			if (existing == null) {
				owned.put(key, Contact.builder().name(name).contactId(emptyToNull(contactId)).build());
			} else if (name != null && !name.isEmpty()) {
				existing.setName(name);
			}
		}
	}

	@Override
	public List<Contact> listContacts(String ownerId) {
		Map<String, Contact> owned = contacts.get(ownerId);
		if (owned == null) {
			return new ArrayList<>();
		}
		List<Contact> result = new ArrayList<>();
		synchronized (owned) {
			for (Contact c : owned.values()) {
				result.add(c.toBuilder().build());
			}
		}
		result.sort(Comparator.comparing(c -> Objects.toString(c.getName(), "")));
		return result;
	}

	@Override
	public boolean deleteContact(String ownerId, String name, String contactId) {
		Map<String, Contact> owned = contacts.get(ownerId);
		if (owned == null) {
			return false;
		}
		synchronized (owned) {
			if (contactId != null && !contactId.isEmpty()) {
				return owned.remove(Contact.storageKey(null, contactId)) != null;
			}
			if (owned.remove(Contact.storageKey(name, null)) != null) {
				return true;
			}
			Iterator<Contact> it = owned.values().iterator();
			while (it.hasNext()) {
				if (Objects.equals(it.next().getName(), name)) {
					it.remove();
					return true;
				}
			}
			return false;
		}
	}

	private static String emptyToNull(String s) {
		return s == null || s.isEmpty() ? null : s;
	}
}
