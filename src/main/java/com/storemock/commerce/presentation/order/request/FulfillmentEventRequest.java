package com.storemock.commerce.presentation.order.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * 배송 이벤트 추가 요청 (id, timestamp가 없으면 서버에서 채움)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FulfillmentEventRequest {

    private String id;

    @NotBlank(message = "이벤트 타입은 필수입니다")
    private String type;

    private Instant timestamp;

    @JsonProperty("line_item_ids")
    private List<String> lineItemIds;

    private TrackingRequest tracking;

    private String description;
}
