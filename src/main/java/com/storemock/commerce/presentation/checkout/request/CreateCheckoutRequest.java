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
 * 체크아웃 생성 요청 DTO
 *
 * line_items[].item.id는 상품 ID이며, 제목과 가격은 카탈로그 값을 사용합니다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateCheckoutRequest {

    private String currency;

    private Map<String, Object> buyer;

    @Valid
    @JsonProperty("line_items")
    private List<LineItemRequest> lineItems;

    private PaymentRequest payment;

    @Valid
    private FulfillmentRequest fulfillment;

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class LineItemRequest {

        @Valid
        @NotNull
        private ItemRequest item;

        private Integer quantity;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ItemRequest {

        @NotBlank
        private String id;

        private String title;
    }
}
