package com.storemock.commerce.domain.order;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 주문 라인 아이템 (체크아웃 라인 아이템의 불변 스냅샷)
 * ID는 체크아웃 라인 아이템 ID와 무관하게 새로 발급됩니다.
 */
@Getter
@AllArgsConstructor
public class OrderLineItem {

    private final String lineItemId;
    private final String productId;
    private final String title;
    private final long price;
    private final int quantity;

    public long lineTotal() {
        return price * quantity;
    }
}
