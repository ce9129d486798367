package com.storemock.commerce.domain.fulfillment;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 배송 옵션 (배송 요율 + 무료배송 프로모션 적용 결과)
 *
 * id는 배송 요율(ShippingRate) ID와 같습니다.
 * 응답에서는 totals: [subtotal, total] 두 항목으로 노출되며 두 금액은 같습니다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FulfillmentOption {

    private String id;
    private String title;
    private long price;
}
