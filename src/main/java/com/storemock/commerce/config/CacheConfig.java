package com.storemock.commerce.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.storemock.commerce.application.idempotency.IdempotencyRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 프로세스 내부 캐시 설정 (Caffeine)
 *
 * - idempotencyStore: 멱등성 키 → (요청 해시, 응답), 크기/TTL은 commerce.idempotency.*
 * - agentProfileCache: 에이전트 프로필 URL → 프로필 JSON, 크기/TTL은 commerce.webhook.profile-cache-*
 */
@Configuration
@RequiredArgsConstructor
public class CacheConfig {

    private final CommerceProperties properties;

    @Bean
    public Cache<String, IdempotencyRecord> idempotencyStore() {
        return Caffeine.newBuilder()
                .maximumSize(properties.getIdempotency().getMaxEntries())
                .expireAfterWrite(properties.getIdempotency().getTtl())
                .build();
    }

    @Bean
    public Cache<String, JsonNode> agentProfileCache() {
        return Caffeine.newBuilder()
                .maximumSize(properties.getWebhook().getProfileCacheSize())
                .expireAfterWrite(properties.getWebhook().getProfileCacheTtl())
                .build();
    }
}
