package com.storemock.commerce.domain.webhook;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

/**
 * 웹훅 전송 시도 기록 (재시도 없음, 결과만 기록)
 */
@Getter
@Builder
@AllArgsConstructor
public class WebhookDelivery {

    private final String deliveryId;
    private final WebhookEventType eventType;
    private final String orderId;
    private final String checkoutId;
    private final String webhookUrl;
    private final DeliveryOutcome outcome;
    private final Integer httpStatus;
    private final String errorMessage;
    private final Instant attemptedAt;
}
