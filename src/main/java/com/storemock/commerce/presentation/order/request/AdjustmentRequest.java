package com.storemock.commerce.presentation.order.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 조정 내역 추가 요청 (환불, 반품 등)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdjustmentRequest {

    private String id;

    @NotBlank(message = "조정 타입은 필수입니다")
    private String type;

    private long amount;

    private String status;

    private String description;

    private Instant timestamp;
}
