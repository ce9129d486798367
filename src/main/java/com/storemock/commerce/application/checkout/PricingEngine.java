package com.storemock.commerce.application.checkout;

import com.storemock.commerce.domain.checkout.AppliedDiscount;
import com.storemock.commerce.domain.checkout.Checkout;
import com.storemock.commerce.domain.checkout.CheckoutLineItem;
import com.storemock.commerce.domain.discount.DiscountType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * PricingEngine - 체크아웃 금액 계산 (순수 계산 로직)
 *
 * 역할:
 * - subtotal = Σ(price × quantity)
 * - 할인을 적용 순서대로 누적 금액(running total)에 순차 적용
 * - 배송비는 할인 후에 더하며 할인 대상이 아님
 *
 * 할인 규칙:
 * - PERCENTAGE v: newRunning = floor(running × (100 - v) / 100), 기여 금액 = running - newRunning
 * - FIXED v: 기여 금액 = v, running = max(0, running - v)
 *
 * 부수 효과 없음. 결과 저장은 CheckoutService 책임입니다.
 */
@Component
public class PricingEngine {

    public PriceBreakdown recalculate(Checkout checkout) {
        return recalculate(checkout.getLineItems(), checkout.getAppliedDiscounts(),
                checkout.getFulfillment().selectedOptionsPrice());
    }

    public PriceBreakdown recalculate(List<CheckoutLineItem> lineItems,
                                      List<AppliedDiscount> discounts,
                                      long fulfillmentPrice) {
        long subtotal = lineItems.stream()
                .mapToLong(CheckoutLineItem::lineTotal)
                .sum();

        long running = subtotal;
        long discountAmount = 0L;
        List<PriceBreakdown.DiscountLine> lines = new ArrayList<>();

        for (AppliedDiscount discount : discounts) {
            long amount;
            if (discount.getType() == DiscountType.PERCENTAGE) {
                long newRunning = Math.floorDiv(running * (100 - discount.getValue()), 100L);
                amount = running - newRunning;
                running = newRunning;
            } else {
                amount = discount.getValue();
                running = Math.max(0L, running - discount.getValue());
            }
            discountAmount += amount;
            lines.add(new PriceBreakdown.DiscountLine(discount.getCode(), titleOf(discount), amount));
        }

        long total = Math.max(0L, Math.max(0L, subtotal - discountAmount) + fulfillmentPrice);
        return new PriceBreakdown(subtotal, discountAmount, fulfillmentPrice, total, lines);
    }

    /**
     * 할인 표시 제목
     * - PERCENTAGE: "10% Off"
     * - FIXED: "$5.00 Off"
     */
    static String titleOf(AppliedDiscount discount) {
        if (discount.getType() == DiscountType.PERCENTAGE) {
            return discount.getValue() + "% Off";
        }
        return String.format(Locale.US, "$%.2f Off", discount.getValue() / 100.0);
    }
}
