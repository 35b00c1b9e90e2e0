package com.echo.signaling_service.repo;

import java.util.List;

import com.echo.signaling_service.dto.ChatMessage;
import com.echo.signaling_service.dto.Contact;

/**
 * Read/write contract of the chat message and contacts store.
 */
public interface ChatStore {

	/**
	 * Append a message to the history of {@code room}, or of the global partition when
	 * {@code room} is null.
	 */
	void appendMessage(String name, String text, long ts, String room);

	/**
	 * Up to {@code limit} of the most recent messages, oldest first. A null room queries
	 * the whole timeline.
	 */
	List<ChatMessage> queryMessages(String room, int limit);

	/**
	 * Insert or update a contact of {@code ownerId}. A contact is identified by its
	 * contact id when one is given, by its name otherwise.
	 */
	void upsertContact(String ownerId, String name, String contactId);

	/**
	 * Contacts of {@code ownerId}, sorted by name.
	 */
	List<Contact> listContacts(String ownerId);

	/**
	 * Delete one contact, by contact id when given, by name otherwise.
	 *
	 * @return true if a contact was removed
	 */
	boolean deleteContact(String ownerId, String name, String contactId);
}
