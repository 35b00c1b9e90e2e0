package com.echo.signaling_service.repo;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.springframework.data.redis.core.StringRedisTemplate;

import com.echo.signaling_service.constants.ApplicationConstants;
import com.echo.signaling_service.dto.ChatMessage;
import com.echo.signaling_service.dto.Contact;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;

/**
 * Redis-backed store.
 *
 * Messages: capped lists, one per room ({@code chat:messages:room:<room>}) plus the
 * whole timeline ({@code chat:messages:all}). Contacts: one hash per owner
 * ({@code contacts:<ownerId>}), field = storage key, value = JSON contact.
 *
 * Redis failures propagate as runtime exceptions so the caller can fall back.
 */
@Slf4j
public class RedisChatStore implements ChatStore {

	private final StringRedisTemplate redisTemplate;
	private final ObjectMapper objectMapper;
	private final int messageCap;

	public RedisChatStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, int messageCap) {
		this.redisTemplate = redisTemplate;
		this.objectMapper = objectMapper;
		this.messageCap = messageCap;
	}

	@Override
	public void appendMessage(String name, String text, long ts, String room) {
		ChatMessage message = ChatMessage.builder().name(name).text(text).ts(ts).room(room).build();
		String json = toJson(message);
		pushCapped(ApplicationConstants.CHAT_TIMELINE_KEY, json);
		if (room != null) {
			pushCapped(roomKey(room), json);
		}
		log.debug("Stored message from '{}' in room={}", name, room);
	}

	@Override
	public List<ChatMessage> queryMessages(String room, int limit) {
		if (limit <= 0) {
			return new ArrayList<>();
		}
		String key = room == null ? ApplicationConstants.CHAT_TIMELINE_KEY : roomKey(room);
		List<String> raw = redisTemplate.opsForList().range(key, -limit, -1);
		List<ChatMessage> messages = new ArrayList<>();
		if (raw == null) {
			return messages;
		}
		for (String json : raw) {
			try {
				messages.add(objectMapper.readValue(json, ChatMessage.class));
			} catch (JsonProcessingException e) {
				log.warn("Skipping unreadable message in '{}': {}", key, e.getMessage());
			}
		}
		messages.sort(Comparator.comparingLong(ChatMessage::getTs));
		return messages;
	}

	@Override
	public void upsertContact(String ownerId, String name, String contactId) {
		String key = contactsKey(ownerId);
		String field = Contact.storageKey(name, contactId);
		Object existingJson = redisTemplate.opsForHash().get(key, field);
		Contact contact;
		if (existingJson == null) {
			contact = Contact.builder().name(name)
					.contactId(contactId == null || contactId.isEmpty() ? null : contactId).build();
		} else {
			contact = fromJson(existingJson.toString());
			if (name != null && !name.isEmpty()) {
				contact.setName(name);
			}
		}
		redisTemplate.opsForHash().put(key, field, toJson(contact));
	}

	@Override
	public List<Contact> listContacts(String ownerId) {
		Map<Object, Object> entries = redisTemplate.opsForHash().entries(contactsKey(ownerId));
		List<Contact> contacts = new ArrayList<>();
		for (Object json : entries.values()) {
			contacts.add(fromJson(json.toString()));
		}
		contacts.sort(Comparator.comparing(c -> Objects.toString(c.getName(), "")));
		return contacts;
	}

	@Override
	public boolean deleteContact(String ownerId, String name, String contactId) {
		String key = contactsKey(ownerId);
		if (contactId != null && !contactId.isEmpty()) {
			Long removed = redisTemplate.opsForHash().delete(key, Contact.storageKey(null, contactId));
			return removed != null && removed > 0;
		}
		Long removed = redisTemplate.opsForHash().delete(key, Contact.storageKey(name, null));
		if (removed != null && removed > 0) {
			return true;
		}
		for (Map.Entry<Object, Object> entry : redisTemplate.opsForHash().entries(key).entrySet()) {
			if (Objects.equals(fromJson(entry.getValue().toString()).getName(), name)) {
				redisTemplate.opsForHash().delete(key, entry.getKey());
				return true;
			}
		}
		return false;
	}

	private void pushCapped(String key, String json) {
		redisTemplate.opsForList().rightPush(key, json);
		redisTemplate.opsForList().trim(key, -messageCap, -1);
	}

	private String roomKey(String room) {
		return ApplicationConstants.CHAT_ROOM_MESSAGES_KEY_PREFIX + room;
	}

	private String contactsKey(String ownerId) {
		return ApplicationConstants.CONTACTS_KEY_PREFIX + ownerId;
	}

	private String toJson(Object value) {
		try {
			return objectMapper.writeValueAsString(value);
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Cannot serialize " + value.getClass().getSimpleName(), e);
		}
	}

	private Contact fromJson(String json) {
		try {
			return objectMapper.readValue(json, Contact.class);
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Corrupt contact entry: " + json, e);
		}
	}
}
