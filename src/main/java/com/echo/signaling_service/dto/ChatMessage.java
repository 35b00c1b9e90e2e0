package com.echo.signaling_service.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class ChatMessage {

	private String id;      // sender connection id, not persisted
	private String name;
	private String text;
	private long ts;
	private String room;    // null = global
}
