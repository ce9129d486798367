package com.storemock.commerce.domain.fulfillment;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 배송 그룹 - 라인 아이템 묶음과 선택 가능한 옵션 메뉴
 *
 * selectedOptionTitle/selectedOptionPrice는 옵션이 선택된 시점의 값입니다.
 * 주문 생성 시 fulfillment expectation 설명(description)으로 그대로 사용됩니다.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FulfillmentGroup {

    private String id;

    @Builder.Default
    private List<String> lineItemIds = new ArrayList<>();

    @Builder.Default
    private List<FulfillmentOption> options = new ArrayList<>();

    private String selectedOptionId;
    private String selectedOptionTitle;
    private long selectedOptionPrice;

    public boolean hasSelectedOption() {
        return selectedOptionId != null && !selectedOptionId.isBlank();
    }

    public Optional<FulfillmentOption> findOption(String optionId) {
        return options.stream()
                .filter(option -> option.getId().equals(optionId))
                .findFirst();
    }

    /**
     * 옵션 선택 결과 기록
     */
    public void select(FulfillmentOption option) {
        this.selectedOptionId = option.getId();
        this.selectedOptionTitle = option.getTitle();
        this.selectedOptionPrice = option.getPrice();
    }

    public void clearSelection() {
        this.selectedOptionId = null;
        this.selectedOptionTitle = null;
        this.selectedOptionPrice = 0L;
    }

    public FulfillmentGroup copy() {
        return FulfillmentGroup.builder()
                .id(id)
                .lineItemIds(new ArrayList<>(lineItemIds))
                .options(new ArrayList<>(options))
                .selectedOptionId(selectedOptionId)
                .selectedOptionTitle(selectedOptionTitle)
                .selectedOptionPrice(selectedOptionPrice)
                .build();
    }
}
