package com.storemock.commerce.config;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * 외부 HTTP 호출용 RestTemplate 설정
 *
 * 에이전트 프로필 조회와 웹훅 POST에 사용합니다. 타임아웃은 commerce.webhook.* 값을 따릅니다.
 */
@Configuration
@RequiredArgsConstructor
public class RestClientConfig {

    private final CommerceProperties properties;

    @Bean
    public RestTemplate webhookRestTemplate(RestTemplateBuilder builder) {
        return builder
                .connectTimeout(properties.getWebhook().getConnectTimeout())
                .readTimeout(properties.getWebhook().getReadTimeout())
                .build();
    }
}
