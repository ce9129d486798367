package com.storemock.commerce.presentation.checkout.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * 체크아웃 일반 업데이트 요청 DTO (PUT, 부분 업데이트)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateCheckoutRequest {

    private String currency;

    private Map<String, Object> buyer;

    @Valid
    @JsonProperty("line_items")
    private List<LineItemQuantityRequest> lineItems;

    @Valid
    private FulfillmentRequest fulfillment;

    private DiscountsRequest discounts;

    private PaymentRequest payment;

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class LineItemQuantityRequest {

        @NotBlank
        private String id;

        @NotNull
        private Integer quantity;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DiscountsRequest {
        private List<String> codes;
    }
}
