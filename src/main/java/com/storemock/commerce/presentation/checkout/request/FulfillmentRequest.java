package com.storemock.commerce.presentation.checkout.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 배송 정보 요청 DTO (체크아웃 생성/업데이트 공용)
 *
 * 요청에 없는 필드(null)는 기존 값을 유지합니다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FulfillmentRequest {

    @Valid
    private List<MethodRequest> methods;

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MethodRequest {
        private String id;
        private String type;

        @JsonProperty("line_item_ids")
        private List<String> lineItemIds;

        @Valid
        private List<AddressRequest> destinations;

        @JsonProperty("selected_destination_id")
        private String selectedDestinationId;

        @Valid
        private List<GroupRequest> groups;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GroupRequest {
        private String id;

        @JsonProperty("line_item_ids")
        private List<String> lineItemIds;

        @JsonProperty("selected_option_id")
        private String selectedOptionId;
    }
}
