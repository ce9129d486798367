package com.storemock.commerce.domain.order.event;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;

/**
 * 체크아웃 완료(주문 생성) 이벤트
 *
 * agentReference: 요청의 UCP-Agent 헤더 값 (웹훅 URL 조회용, 없을 수 있음)
 */
@Getter
@AllArgsConstructor
public class CheckoutCompletedEvent {

    private final String checkoutId;
    private final String orderId;
    private final String agentReference;
    private final Instant occurredAt;

    public static CheckoutCompletedEvent of(String checkoutId, String orderId, String agentReference) {
        return new CheckoutCompletedEvent(checkoutId, orderId, agentReference, Instant.now());
    }
}
