package com.storemock.commerce.application.checkout.dto;

import com.storemock.commerce.application.checkout.PriceBreakdown;
import com.storemock.commerce.domain.checkout.Checkout;
import com.storemock.commerce.domain.order.Order;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * CheckoutService 처리 결과 (체크아웃 + 최신 금액 계산 + 생성된 주문)
 */
@Getter
@AllArgsConstructor
public class CheckoutResult {

    private final Checkout checkout;
    private final PriceBreakdown pricing;
    private final Order order;
}
