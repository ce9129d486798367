package com.storemock.commerce.application.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.storemock.commerce.common.exception.ErrorCode;
import com.storemock.commerce.common.exception.SystemException;
import com.storemock.commerce.common.protocol.UcpProtocol;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * AgentProfileClient - UCP-Agent 헤더로 에이전트 프로필을 조회하고 웹훅 URL 추출
 *
 * 헤더 형식: profile="https://agent.example/profile.json"
 * 웹훅 URL 위치: ucp.capabilities[name=dev.ucp.shopping.order].config.webhook_url
 *
 * 프로필은 200 응답만 유효하며 성공한 조회 결과만 캐시합니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AgentProfileClient {

    private static final Pattern PROFILE_PATTERN = Pattern.compile("profile=\"([^\"]+)\"");

    private final RestTemplate webhookRestTemplate;
    private final Cache<String, JsonNode> agentProfileCache;

    /**
     * 헤더 값에서 프로필 URL 추출 (형식이 맞지 않으면 empty)
     */
    public Optional<String> parseProfileUrl(String agentReference) {
        if (agentReference == null || agentReference.isBlank()) {
            return Optional.empty();
        }
        Matcher matcher = PROFILE_PATTERN.matcher(agentReference);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    /**
     * 에이전트 프로필 조회 (캐시 우선)
     *
     * @throws SystemException 200이 아닌 응답 또는 통신 오류 (AGENT_PROFILE_UNAVAILABLE)
     */
    public JsonNode fetchProfile(String profileUrl) {
        JsonNode cached = agentProfileCache.getIfPresent(profileUrl);
        if (cached != null) {
            return cached;
        }

        ResponseEntity<JsonNode> response;
        try {
            response = webhookRestTemplate.getForEntity(profileUrl, JsonNode.class);
        } catch (RestClientException e) {
            throw new SystemException(ErrorCode.AGENT_PROFILE_UNAVAILABLE, e);
        }
        if (response.getStatusCode() != HttpStatus.OK || response.getBody() == null) {
            throw new SystemException(ErrorCode.AGENT_PROFILE_UNAVAILABLE,
                    "url=" + profileUrl + ", status=" + response.getStatusCode().value());
        }

        agentProfileCache.put(profileUrl, response.getBody());
        log.debug("[AgentProfileClient] 프로필 캐시 저장 - url={}", profileUrl);
        return response.getBody();
    }

    /**
     * 에이전트 참조(UCP-Agent 헤더)로 주문 웹훅 URL 조회
     */
    public Optional<String> resolveWebhookUrl(String agentReference) {
        Optional<String> profileUrl = parseProfileUrl(agentReference);
        if (profileUrl.isEmpty()) {
            return Optional.empty();
        }
        return extractWebhookUrl(fetchProfile(profileUrl.get()));
    }

    static Optional<String> extractWebhookUrl(JsonNode profile) {
        JsonNode capabilities = profile.path("ucp").path("capabilities");
        for (JsonNode capability : capabilities) {
            if (UcpProtocol.ORDER_CAPABILITY.equals(capability.path("name").asText())) {
                String url = capability.path("config").path("webhook_url").asText(null);
                if (url != null && !url.isBlank()) {
                    return Optional.of(url);
                }
            }
        }
        return Optional.empty();
    }
}
