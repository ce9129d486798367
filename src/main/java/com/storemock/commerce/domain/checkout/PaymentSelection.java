package com.storemock.commerce.domain.checkout;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * 결제 수단 선택 (핸들러 ID + instrument)
 */
@Getter
@AllArgsConstructor
public class PaymentSelection {

    private final String handlerId;
    private final Map<String, Object> instrument;

    public static PaymentSelection of(String handlerId, Map<String, Object> instrument) {
        return new PaymentSelection(handlerId,
                instrument == null ? Collections.emptyMap() : Collections.unmodifiableMap(new HashMap<>(instrument)));
    }

    public String getInstrumentId() {
        Object id = instrument.get("id");
        return id == null ? null : id.toString();
    }
}
