package com.storemock.commerce.domain.checkout;

import com.storemock.commerce.domain.product.Product;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * CheckoutLineItem - 체크아웃 라인 아이템
 *
 * 제목과 단가는 추가 시점의 카탈로그 값을 복사합니다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckoutLineItem {

    private String lineItemId;
    private String productId;
    private String variantId;
    private String title;
    private long price;
    private int quantity;

    public static CheckoutLineItem of(Product product, String variantId, int quantity) {
        return CheckoutLineItem.builder()
                .lineItemId(UUID.randomUUID().toString())
                .productId(product.getProductId())
                .variantId(variantId)
                .title(product.getTitle())
                .price(product.getPrice())
                .quantity(quantity)
                .build();
    }

    public long lineTotal() {
        return price * quantity;
    }

    public boolean isSameProduct(String productId, String variantId) {
        if (!this.productId.equals(productId)) {
            return false;
        }
        return this.variantId == null ? variantId == null : this.variantId.equals(variantId);
    }

    void changeQuantity(int quantity) {
        this.quantity = quantity;
    }

    CheckoutLineItem copy() {
        return new CheckoutLineItem(lineItemId, productId, variantId, title, price, quantity);
    }
}
