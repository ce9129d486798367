package com.storemock.commerce.application.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.storemock.commerce.common.exception.ErrorCode;
import com.storemock.commerce.common.exception.SystemException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.ExpectedCount.once;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

/**
 * AgentProfileClientTest - 에이전트 프로필 조회 테스트
 *
 * MockRestServiceServer로 프로필 서버를 대신합니다.
 */
@DisplayName("AgentProfileClient 테스트")
class AgentProfileClientTest {

    private static final String PROFILE_URL = "https://agent.example/profile.json";
    private static final String PROFILE_JSON =
            "{\"ucp\": {\"version\": \"2026-01-11\", \"capabilities\": ["
                    + "{\"name\": \"dev.ucp.shopping.checkout\", \"config\": {}},"
                    + "{\"name\": \"dev.ucp.shopping.order\", \"config\": {\"webhook_url\": \"https://agent.example/webhooks\"}}"
                    + "]}}";

    private MockRestServiceServer server;
    private AgentProfileClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new AgentProfileClient(restTemplate, Caffeine.newBuilder().<String, JsonNode>build());
    }

    @Test
    @DisplayName("헤더에서 profile URL 추출, 형식이 다르면 empty")
    void testParseProfileUrl() {
        assertEquals(Optional.of(PROFILE_URL), client.parseProfileUrl("profile=\"" + PROFILE_URL + "\""));
        assertEquals(Optional.of(PROFILE_URL), client.parseProfileUrl("version=1; profile=\"" + PROFILE_URL + "\""));
        assertTrue(client.parseProfileUrl(PROFILE_URL).isEmpty());
        assertTrue(client.parseProfileUrl(null).isEmpty());
        assertTrue(client.parseProfileUrl(" ").isEmpty());
    }

    @Test
    @DisplayName("order capability의 webhook_url 조회, 프로필은 한 번만 요청 (캐시)")
    void testResolveWebhookUrl_Cached() {
        // Given
        server.expect(once(), requestTo(PROFILE_URL))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess(PROFILE_JSON, MediaType.APPLICATION_JSON));
        String header = "profile=\"" + PROFILE_URL + "\"";

        // When
        Optional<String> first = client.resolveWebhookUrl(header);
        Optional<String> second = client.resolveWebhookUrl(header);

        // Then
        assertEquals(Optional.of("https://agent.example/webhooks"), first);
        assertEquals(first, second);
        server.verify();
    }

    @Test
    @DisplayName("프로필 서버 오류 → AGENT_PROFILE_UNAVAILABLE, 실패는 캐시하지 않음")
    void testFetchProfile_ServerError() {
        server.expect(requestTo(PROFILE_URL)).andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR));
        server.expect(requestTo(PROFILE_URL)).andRespond(withSuccess(PROFILE_JSON, MediaType.APPLICATION_JSON));

        SystemException exception = assertThrows(SystemException.class, () -> client.fetchProfile(PROFILE_URL));
        JsonNode retried = client.fetchProfile(PROFILE_URL);

        assertEquals(ErrorCode.AGENT_PROFILE_UNAVAILABLE, exception.getErrorCode());
        assertTrue(retried.has("ucp"));
        server.verify();
    }

    @Test
    @DisplayName("order capability가 없거나 webhook_url이 비어 있으면 empty")
    void testExtractWebhookUrl_Missing() throws Exception {
        ObjectMapper objectMapper = new ObjectMapper();
        JsonNode noOrder = objectMapper.readTree(
                "{\"ucp\": {\"capabilities\": [{\"name\": \"dev.ucp.shopping.checkout\"}]}}");
        JsonNode blankUrl = objectMapper.readTree(
                "{\"ucp\": {\"capabilities\": [{\"name\": \"dev.ucp.shopping.order\", \"config\": {\"webhook_url\": \"\"}}]}}");

        assertTrue(AgentProfileClient.extractWebhookUrl(noOrder).isEmpty());
        assertTrue(AgentProfileClient.extractWebhookUrl(blankUrl).isEmpty());
        assertTrue(AgentProfileClient.extractWebhookUrl(objectMapper.createObjectNode()).isEmpty());
    }
}
