package com.storemock.commerce.presentation.checkout.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class ApplyDiscountRequest {

    @NotBlank
    private String code;
}
