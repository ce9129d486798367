package com.storemock.commerce.domain.order;

import lombok.Getter;

/**
 * OrderStatus - 주문 상태
 *
 * 상태 전환 규칙:
 * CONFIRMED (생성) → SHIPPED (배송 시뮬레이션)
 * PENDING, CONFIRMED → CANCELED (주문 취소)
 */
@Getter
public enum OrderStatus {
    PENDING("pending"),
    CONFIRMED("confirmed"),
    SHIPPED("shipped"),
    CANCELED("canceled");

    private final String value;

    OrderStatus(String value) {
        this.value = value;
    }

    public boolean isCancellable() {
        return this == PENDING || this == CONFIRMED;
    }

    public static OrderStatus fromString(String status) {
        if (status != null) {
            String normalized = status.trim().toLowerCase();
            if ("cancelled".equals(normalized)) {
                return CANCELED;
            }
            for (OrderStatus orderStatus : values()) {
                if (orderStatus.value.equals(normalized)) {
                    return orderStatus;
                }
            }
        }
        throw new InvalidOrderStatusException(null, "유효하지 않은 주문 상태입니다: " + status);
    }
}
