package com.storemock.commerce.presentation.checkout.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 체크아웃 완료 요청 DTO (본문 생략 가능)
 *
 * 결제수단 ID 우선순위: payment_data.id → payment.selected_instrument_id → 체크아웃에 저장된 결제수단
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompleteCheckoutRequest {

    @JsonProperty("payment_data")
    private Map<String, Object> paymentData;

    private PaymentRequest payment;
}
