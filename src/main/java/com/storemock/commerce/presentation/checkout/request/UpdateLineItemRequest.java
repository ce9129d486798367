package com.storemock.commerce.presentation.checkout.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class UpdateLineItemRequest {

    @NotNull
    private Integer quantity;
}
