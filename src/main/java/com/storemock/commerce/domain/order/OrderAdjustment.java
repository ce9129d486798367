package com.storemock.commerce.domain.order;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

/**
 * 주문 조정 내역 (환불, 반품 등) - 주문에 추가만 가능
 */
@Getter
@Builder
@AllArgsConstructor
public class OrderAdjustment {

    private final String adjustmentId;
    private final String type;
    private final long amount;
    private final String status;
    private final String description;
    private final Instant occurredAt;
}
