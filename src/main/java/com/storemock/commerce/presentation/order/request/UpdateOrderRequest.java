package com.storemock.commerce.presentation.order.request;

import jakarta.validation.Valid;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 주문 업데이트 요청 DTO
 *
 * {
 *   "fulfillment": {"events": [...]},
 *   "adjustments": [...],
 *   "status": "shipped"
 * }
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateOrderRequest {

    @Valid
    private FulfillmentUpdate fulfillment;

    @Valid
    private List<AdjustmentRequest> adjustments;

    private String status;

    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FulfillmentUpdate {

        @Valid
        private List<FulfillmentEventRequest> events;
    }
}
