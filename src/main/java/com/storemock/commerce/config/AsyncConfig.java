package com.storemock.commerce.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * 비동기 실행기 설정
 *
 * webhookExecutor:
 * - 웹훅 전송 전용 스레드풀 (요청 처리 스레드와 분리)
 * - 종료 시 대기 중인 전송을 기다리지 않음
 * - 큐가 가득 차면 TaskRejectedException (WebhookEventListener에서 로깅)
 */
@Configuration
@RequiredArgsConstructor
public class AsyncConfig {

    public static final String WEBHOOK_EXECUTOR = "webhookExecutor";

    private final CommerceProperties properties;

    @Bean(name = WEBHOOK_EXECUTOR)
    public ThreadPoolTaskExecutor webhookExecutor() {
        CommerceProperties.Webhook webhook = properties.getWebhook();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(webhook.getCorePoolSize());
        executor.setMaxPoolSize(Math.max(webhook.getCorePoolSize(), webhook.getMaxPoolSize()));
        executor.setQueueCapacity(webhook.getQueueCapacity());
        executor.setThreadNamePrefix("webhook-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
