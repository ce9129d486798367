package com.storemock.commerce.domain.discount;

import lombok.Getter;

/**
 * 할인 유형
 * - PERCENTAGE: 누적 금액(running total)에 대한 비율 할인
 * - FIXED: 누적 금액에서 고정 금액 차감 (0 미만으로 내려가지 않음)
 */
@Getter
public enum DiscountType {
    PERCENTAGE("percentage"),
    FIXED("fixed");

    private final String value;

    DiscountType(String value) {
        this.value = value;
    }

    public static DiscountType fromString(String value) {
        for (DiscountType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("유효하지 않은 할인 유형입니다: " + value);
    }
}
