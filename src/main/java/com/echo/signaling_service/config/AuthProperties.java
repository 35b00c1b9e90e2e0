package com.echo.signaling_service.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

/**
 * Token issuing and verification settings.
 */
@Data
@Component
@ConfigurationProperties(prefix = "auth")
public class AuthProperties {

    /**
     * remote: delegate to the auth service at {@link #url}; local: sign and verify HS256
     * tokens in-process.
     */
    private String verifier = "remote";

    /**
     * Base URL of the auth service (remote mode).
     */
    private String url = "http://localhost:8081";

    /**
     * Lifetime of tokens issued by POST /auth/login when the request names none.
     */
    private long defaultTtlSeconds = 3600L;

    private Jwt jwt = new Jwt();

    @Data
    public static class Jwt {

        /**
         * Signing keys as {@code kid:secret} pairs separated by commas. Secrets must be at
         * least 32 bytes.
         */
        private String secrets;

        /**
         * Single key used when {@link #secrets} is empty; registered under kid "default".
         */
        private String secret;

        /**
         * Key used to sign new tokens; defaults to the first configured key.
         */
        private String activeKid;
    }
}
