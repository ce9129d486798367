package com.storemock.commerce.application.checkout.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 * 일반 업데이트 명령 (부분 업데이트, null 필드는 변경 없음)
 */
@Getter
@Builder
@AllArgsConstructor
public class UpdateCheckoutCommand {

    private final String currency;
    private final Map<String, Object> buyer;
    private final List<LineItemQuantityCommand> lineItems;
    private final FulfillmentUpdateCommand fulfillment;
    private final List<String> discountCodes;
    private final SetPaymentCommand payment;
}
