package com.storemock.commerce.domain.fulfillment;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Promotion - 무료배송 프로모션 참조 데이터
 *
 * 적용 조건 (둘 중 하나):
 * - 금액 조건: minSubtotal이 설정되어 있고 subtotal >= minSubtotal
 * - 상품 조건: 체크아웃 상품 중 하나라도 eligibleItemIds에 포함
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Promotion {

    private String id;
    private PromotionType type;
    private Long minSubtotal;

    @Builder.Default
    private Set<String> eligibleItemIds = new HashSet<>();

    @Builder.Default
    private boolean active = true;

    public boolean matches(long subtotal, Collection<String> productIds) {
        if (minSubtotal != null && minSubtotal > 0 && subtotal >= minSubtotal) {
            return true;
        }
        return productIds.stream().anyMatch(eligibleItemIds::contains);
    }
}
