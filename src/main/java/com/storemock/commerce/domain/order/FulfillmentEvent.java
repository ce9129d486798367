package com.storemock.commerce.domain.order;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.List;

/**
 * 배송 이벤트 (shipped, delivered 등) - 주문에 추가만 가능
 */
@Getter
@Builder
@AllArgsConstructor
public class FulfillmentEvent {

    public static final String TYPE_SHIPPED = "shipped";

    private final String eventId;
    private final String type;
    private final Instant occurredAt;
    private final List<String> lineItemIds;
    private final TrackingInfo tracking;
    private final String description;
}
