package com.storemock.commerce.application.checkout.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.util.List;
import java.util.Map;

@Getter
@Builder
@AllArgsConstructor
public class CreateCheckoutCommand {

    private final String currency;
    private final Map<String, Object> buyer;
    private final List<LineItemCommand> lineItems;
    private final SetPaymentCommand payment;
    private final FulfillmentUpdateCommand fulfillment;
}
