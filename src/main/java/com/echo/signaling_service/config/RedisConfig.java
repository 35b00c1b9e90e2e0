package com.echo.signaling_service.config;

import java.time.Duration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceClientConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import com.echo.signaling_service.repo.ChatStore;
import com.echo.signaling_service.repo.FallbackChatStore;
import com.echo.signaling_service.repo.InMemoryChatStore;
import com.echo.signaling_service.repo.InMemoryPresenceStore;
import com.echo.signaling_service.repo.PresenceStore;
import com.echo.signaling_service.repo.RedisChatStore;
import com.echo.signaling_service.repo.RedisPresenceStore;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Configuration
public class RedisConfig {

    private static final String MEMORY = "memory";

    @Value("${spring.data.redis.host:localhost}")
    private String redisHost;

    @Value("${spring.data.redis.port:6379}")
    private int redisPort;

    // bounds every command; chat appends run on the sender's socket thread
    @Value("${spring.data.redis.timeout:2000}")
    private long commandTimeoutMs;

    @Bean
    public RedisConnectionFactory redisConnectionFactory() {
        log.info("Initializing RedisConnectionFactory with host={}, port={}, commandTimeout={}ms",
                redisHost, redisPort, commandTimeoutMs);
        LettuceClientConfiguration clientConfig = LettuceClientConfiguration.builder()
                .commandTimeout(Duration.ofMillis(commandTimeoutMs))
                .build();
        return new LettuceConnectionFactory(new RedisStandaloneConfiguration(redisHost, redisPort), clientConfig);
    }

    @Bean
    public StringRedisTemplate stringRedisTemplate(RedisConnectionFactory factory) {
        return new StringRedisTemplate(factory);
    }

    @Bean
    public PresenceStore presenceStore(SignalingProperties properties, StringRedisTemplate redisTemplate) {
        if (MEMORY.equalsIgnoreCase(properties.getPresenceStore())) {
            log.info("Presence sets kept in memory");
            return new InMemoryPresenceStore();
        }
        log.info("Presence sets kept in Redis");
        return new RedisPresenceStore(redisTemplate);
    }

    /**
     * Redis-backed chat and contacts store that degrades to memory while Redis is down.
     */
    @Bean
    public ChatStore chatStore(SignalingProperties properties, StringRedisTemplate redisTemplate,
            ObjectMapper objectMapper) {
        InMemoryChatStore inMemory = new InMemoryChatStore(properties.getInMemoryMessageCap());
        if (MEMORY.equalsIgnoreCase(properties.getStore())) {
            log.info("Chat store kept in memory (cap={})", properties.getInMemoryMessageCap());
            return inMemory;
        }
        log.info("Chat store kept in Redis (cap={}) with in-memory fallback", properties.getRedisMessageCap());
        return new FallbackChatStore(new RedisChatStore(redisTemplate, objectMapper, properties.getRedisMessageCap()),
                inMemory);
    }
}
