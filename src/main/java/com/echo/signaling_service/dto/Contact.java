package com.echo.signaling_service.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@AllArgsConstructor
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Contact {

	private String name;
	private String contactId;
	private Boolean online;   // filled in on read only

	/**
	 * Key under which the contact is stored for its owner: the contact id when present,
	 * the name otherwise.
	 */
	public String storageKey() {
		return storageKey(name, contactId);
	}

	public static String storageKey(String name, String contactId) {
		if (contactId != null && !contactId.isEmpty()) {
			return "id:" + contactId;
		}
		return "name:" + (name == null ? "" : name);
	}
}
