package com.storemock.commerce.domain.order.event;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;

/**
 * 주문 배송(시뮬레이션) 이벤트
 */
@Getter
@AllArgsConstructor
public class OrderShippedEvent {

    private final String checkoutId;
    private final String orderId;
    private final String agentReference;
    private final Instant occurredAt;

    public static OrderShippedEvent of(String checkoutId, String orderId, String agentReference) {
        return new OrderShippedEvent(checkoutId, orderId, agentReference, Instant.now());
    }
}
