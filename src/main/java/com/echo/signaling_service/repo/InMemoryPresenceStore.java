package com.echo.signaling_service.repo;

import java.util.Collections;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryPresenceStore implements PresenceStore {

	private final Map<String, Set<String>> sets = new ConcurrentHashMap<>();

	@Override
	public void add(String key, String member) {
		sets.computeIfAbsent(key, k -> ConcurrentHashMap.newKeySet()).add(member);
	}

	@Override
	public void remove(String key, String member) {
		sets.computeIfPresent(key, (k, set) -> {
			set.remove(member);
			return set.isEmpty() ? null : set;
		});
	}

	@Override
	public Set<String> members(String key) {
		Set<String> set = sets.get(key);
		return set == null ? Collections.emptySet() : new HashSet<>(set);
	}

	@Override
	public boolean contains(String key, String member) {
		Set<String> set = sets.get(key);
		return set != null && set.contains(member);
	}
}
