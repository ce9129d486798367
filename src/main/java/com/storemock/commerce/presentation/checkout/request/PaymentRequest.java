package com.storemock.commerce.presentation.checkout.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 결제 정보 요청 DTO (체크아웃 생성/업데이트/결제 지정 공용)
 *
 * instrument가 없고 selected_instrument_id만 있으면 {"id": selected_instrument_id}로 간주합니다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentRequest {

    @JsonProperty("handler_id")
    private String handlerId;

    private Map<String, Object> instrument;

    @JsonProperty("selected_instrument_id")
    private String selectedInstrumentId;
}
