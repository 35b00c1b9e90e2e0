package com.echo.signaling_service.repo;

import java.util.Collections;
import java.util.Set;

import org.springframework.data.redis.core.StringRedisTemplate;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class RedisPresenceStore implements PresenceStore {

	private final StringRedisTemplate redisTemplate;

	public RedisPresenceStore(StringRedisTemplate redisTemplate) {
		this.redisTemplate = redisTemplate;
	}

	@Override
	public void add(String key, String member) {
		try {
			redisTemplate.opsForSet().add(key, member);
			log.debug("Presence add {} -> {}", member, key);
		} catch (Exception e) {
			log.error("Failed to add '{}' to presence set '{}': {}", member, key, e.getMessage(), e);
		}
	}

	@Override
	public void remove(String key, String member) {
		try {
			redisTemplate.opsForSet().remove(key, member);
			log.debug("Presence remove {} <- {}", member, key);
		} catch (Exception e) {
			log.error("Failed to remove '{}' from presence set '{}': {}", member, key, e.getMessage(), e);
		}
	}

	@Override
	public Set<String> members(String key) {
		try {
			Set<String> members = redisTemplate.opsForSet().members(key);
			return members == null ? Collections.emptySet() : members;
		} catch (Exception e) {
			log.error("Failed to read presence set '{}': {}", key, e.getMessage(), e);
			return Collections.emptySet();
		}
	}

	@Override
	public boolean contains(String key, String member) {
		try {
			return Boolean.TRUE.equals(redisTemplate.opsForSet().isMember(key, member));
		} catch (Exception e) {
			log.error("Failed to check presence of '{}' in '{}': {}", member, key, e.getMessage(), e);
			return false;
		}
	}
}
