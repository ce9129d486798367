package com.storemock.commerce.presentation.checkout.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 라인 아이템 추가 요청 DTO (quantity 생략 시 1)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddLineItemRequest {

    @NotBlank
    @JsonProperty("product_id")
    private String productId;

    @JsonProperty("variant_id")
    private String variantId;

    private Integer quantity;
}
