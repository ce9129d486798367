package com.storemock.commerce.application.checkout.dto;

import com.storemock.commerce.domain.fulfillment.FulfillmentDestination;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 배송 방법 직접 지정 명령 (methodId = 배송 요율 ID)
 */
@Getter
@AllArgsConstructor
public class SetFulfillmentCommand {

    private final String methodId;
    private final FulfillmentDestination address;
}
