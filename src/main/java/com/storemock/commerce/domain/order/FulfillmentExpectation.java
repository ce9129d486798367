package com.storemock.commerce.domain.order;

import com.storemock.commerce.domain.fulfillment.FulfillmentDestination;
import com.storemock.commerce.domain.fulfillment.FulfillmentMethodType;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * 배송 예정 정보 (배송지 + 배송 방법 + 선택 옵션 제목)
 */
@Getter
@AllArgsConstructor
public class FulfillmentExpectation {

    private final String expectationId;
    private final List<ExpectedItem> lineItems;
    private final FulfillmentMethodType methodType;
    private final FulfillmentDestination destination;
    private final String description;

    @Getter
    @AllArgsConstructor
    public static class ExpectedItem {
        private final String lineItemId;
        private final int quantity;
    }
}
