package com.echo.signaling_service.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class ContactRequest {
	private String ownerId;
	private String ownerName;
	private String name;
	private String contactId;
}
