package com.storemock.commerce.application.checkout;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * PricingEngine 계산 결과
 *
 * total = max(0, max(0, subtotal - discountAmount) + fulfillmentPrice)
 */
@Getter
@AllArgsConstructor
public class PriceBreakdown {

    private final long subtotal;
    private final long discountAmount;
    private final long fulfillmentPrice;
    private final long total;
    private final List<DiscountLine> discounts;

    /**
     * 할인 코드별 기여 금액 (적용 순서대로)
     */
    @Getter
    @AllArgsConstructor
    public static class DiscountLine {
        private final String code;
        private final String title;
        private final long amount;
    }
}
