package com.echo.signaling_service.repo;

import java.util.Set;

/**
 * Shared set store behind the presence views. Implementations never throw: a failing
 * backend reads as empty and drops writes.
 */
public interface PresenceStore {

	void add(String key, String member);

	void remove(String key, String member);

	Set<String> members(String key);

	boolean contains(String key, String member);
}
