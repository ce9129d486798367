package com.storemock.commerce.application.checkout.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 체크아웃 완료 명령
 *
 * paymentInstrumentId: 요청 본문의 payment_data.id 또는 payment.selected_instrument_id (없을 수 있음)
 * agentReference: UCP-Agent 헤더 값 (웹훅 대상 조회용, 없을 수 있음)
 */
@Getter
@AllArgsConstructor
public class CompleteCheckoutCommand {

    private final String paymentInstrumentId;
    private final String agentReference;

    public static CompleteCheckoutCommand empty() {
        return new CompleteCheckoutCommand(null, null);
    }
}
