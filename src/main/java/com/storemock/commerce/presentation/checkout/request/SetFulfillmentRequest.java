package com.storemock.commerce.presentation.checkout.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 배송 방법 지정 요청 DTO (method_id = 배송 요율 ID)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SetFulfillmentRequest {

    @NotBlank
    @JsonProperty("method_id")
    private String methodId;

    @Valid
    @NotNull
    private AddressRequest address;
}
