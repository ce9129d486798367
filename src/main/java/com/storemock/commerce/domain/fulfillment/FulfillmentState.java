package com.storemock.commerce.domain.fulfillment;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * 체크아웃의 배송 상태 (method 목록)
 *
 * 완료 조건:
 * - 어떤 method든 선택된 배송지가 있어야 함
 * - 어떤 group이든 선택된 옵션이 있어야 함
 */
@Getter
public class FulfillmentState {

    private final List<FulfillmentMethod> methods;

    public FulfillmentState() {
        this.methods = new ArrayList<>();
    }

    public FulfillmentState(List<FulfillmentMethod> methods) {
        this.methods = new ArrayList<>(methods);
    }

    public boolean isEmpty() {
        return methods.isEmpty();
    }

    public boolean hasSelectedDestination() {
        return methods.stream().anyMatch(FulfillmentMethod::hasSelectedDestination);
    }

    public boolean hasSelectedOption() {
        return methods.stream()
                .flatMap(method -> method.getGroups().stream())
                .anyMatch(FulfillmentGroup::hasSelectedOption);
    }

    /**
     * 선택된 옵션 가격 합계 (배송비)
     */
    public long selectedOptionsPrice() {
        return methods.stream()
                .flatMap(method -> method.getGroups().stream())
                .filter(FulfillmentGroup::hasSelectedOption)
                .mapToLong(FulfillmentGroup::getSelectedOptionPrice)
                .sum();
    }

    public FulfillmentState copy() {
        List<FulfillmentMethod> copied = new ArrayList<>();
        methods.forEach(method -> copied.add(method.copy()));
        return new FulfillmentState(copied);
    }
}
