package com.openmeet.oidc.config;

import com.openmeet.oidc.config.properties.OidcProperties;
import com.openmeet.oidc.ratelimit.DisabledRateLimiter;
import com.openmeet.oidc.ratelimit.InMemoryRateLimiter;
import com.openmeet.oidc.ratelimit.RateLimiter;
import com.openmeet.oidc.ratelimit.RedisRateLimiter;
import com.openmeet.oidc.replay.InMemoryReplayGuard;
import com.openmeet.oidc.replay.RedisReplayGuard;
import com.openmeet.oidc.replay.ReplayGuard;
import com.openmeet.oidc.session.BootstrapTokenStore;
import com.openmeet.oidc.session.InMemoryBootstrapTokenStore;
import com.openmeet.oidc.session.InMemorySessionStore;
import com.openmeet.oidc.session.RedisBootstrapTokenStore;
import com.openmeet.oidc.session.RedisSessionStore;
import com.openmeet.oidc.session.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

/**
 * Shared state: login sessions, bootstrap tokens, consumed codes and rate-limit counters.
 *
 * oidc.store.type:
 * - redis  (default) all replicas share the same state, required for more than one instance
 * - memory single instance only; used by tests and local runs
 */
@Configuration
public class StoreConfig {

    private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

    @Configuration
    @ConditionalOnProperty(name = "oidc.store.type", havingValue = "redis", matchIfMissing = true)
    static class RedisStores {

        @Bean
        public SessionStore sessionStore(StringRedisTemplate redisTemplate, OidcProperties properties, Clock clock) {
            log.info("[STARTUP] Using Redis stores with key prefix '{}'", properties.getStore().getKeyPrefix());
            return new RedisSessionStore(redisTemplate, properties.getStore().getKeyPrefix(), clock,
                properties.getSessionTtl());
        }

        @Bean
        public BootstrapTokenStore bootstrapTokenStore(StringRedisTemplate redisTemplate, OidcProperties properties) {
            return new RedisBootstrapTokenStore(redisTemplate, properties.getStore().getKeyPrefix(),
                properties.getBootstrapTokenTtl());
        }

        @Bean
        public ReplayGuard replayGuard(StringRedisTemplate redisTemplate, OidcProperties properties, Clock clock) {
            return new RedisReplayGuard(redisTemplate, properties.getStore().getKeyPrefix(), clock,
                properties.getAuthorizationCodeTtl());
        }

        @Bean
        public RateLimiter rateLimiter(StringRedisTemplate redisTemplate, OidcProperties properties, Clock clock) {
            OidcProperties.RateLimit rateLimit = properties.getRateLimit();
            if (!rateLimit.isEnabled()) {
                log.warn("[STARTUP] Token endpoint rate limiting is DISABLED");
                return new DisabledRateLimiter();
            }
            return new RedisRateLimiter(redisTemplate, properties.getStore().getKeyPrefix(), clock,
                rateLimit.getMaxRequests(), rateLimit.getWindow());
        }
    }

    @Configuration
    @ConditionalOnProperty(name = "oidc.store.type", havingValue = "memory")
    static class InMemoryStores {

        @Bean
        public SessionStore sessionStore(OidcProperties properties, Clock clock) {
            log.warn("[STARTUP] Using in-memory stores; state is not shared between instances");
            return new InMemorySessionStore(clock, properties.getSessionTtl());
        }

        @Bean
        public BootstrapTokenStore bootstrapTokenStore(OidcProperties properties, Clock clock) {
            return new InMemoryBootstrapTokenStore(clock, properties.getBootstrapTokenTtl());
        }

        @Bean
        public ReplayGuard replayGuard(OidcProperties properties, Clock clock) {
            return new InMemoryReplayGuard(clock, properties.getAuthorizationCodeTtl());
        }

        @Bean
        public RateLimiter rateLimiter(OidcProperties properties, Clock clock) {
            OidcProperties.RateLimit rateLimit = properties.getRateLimit();
            if (!rateLimit.isEnabled()) {
                log.warn("[STARTUP] Token endpoint rate limiting is DISABLED");
                return new DisabledRateLimiter();
            }
            return new InMemoryRateLimiter(clock, rateLimit.getMaxRequests(), rateLimit.getWindow());
        }
    }
}
