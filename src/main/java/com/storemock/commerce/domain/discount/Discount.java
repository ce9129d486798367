package com.storemock.commerce.domain.discount;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Discount - 할인 코드 카탈로그 항목
 *
 * value 의미:
 * - PERCENTAGE: 0~100 사이의 퍼센트
 * - FIXED: 최소 통화 단위 금액
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Discount {

    private String code;
    private DiscountType type;
    private long value;
    private boolean active;
}
