package com.storemock.commerce.domain.product;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Product 도메인 엔티티 (카탈로그 + 재고)
 *
 * 체크아웃 라인 아이템의 제목과 단가는 항상 이 카탈로그 값에서 가져옵니다.
 * 금액은 최소 통화 단위(센트)의 정수입니다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Product {

    private String productId;
    private String title;
    private long price;
    private int stock;

    /**
     * 요청 수량만큼 재고가 있는지 확인
     */
    public boolean hasStock(int quantity) {
        return stock >= quantity;
    }
}
