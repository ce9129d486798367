package com.storemock.commerce.application.checkout.dto;

import com.storemock.commerce.domain.fulfillment.FulfillmentDestination;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * 배송 정보 업데이트 명령
 *
 * null 필드는 "요청에 없음"을 의미하며 기존 값을 유지합니다.
 * (빈 목록은 명시적으로 비우는 요청)
 */
@Getter
@AllArgsConstructor
public class FulfillmentUpdateCommand {

    private final List<MethodUpdate> methods;

    public boolean hasClientDestinations() {
        return methods != null && methods.stream()
                .anyMatch(method -> method.getDestinations() != null && !method.getDestinations().isEmpty());
    }

    @Getter
    @Builder
    @AllArgsConstructor
    public static class MethodUpdate {
        private final String id;
        private final String type;
        private final List<String> lineItemIds;
        private final List<FulfillmentDestination> destinations;
        private final String selectedDestinationId;
        private final List<GroupUpdate> groups;
    }

    @Getter
    @Builder
    @AllArgsConstructor
    public static class GroupUpdate {
        private final String id;
        private final List<String> lineItemIds;
        private final String selectedOptionId;
    }
}
