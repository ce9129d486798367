package com.storemock.commerce.application.checkout.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/**
 * 라인 아이템 추가 명령 (체크아웃 생성 시 목록으로도 사용)
 */
@Getter
@Builder
@AllArgsConstructor
public class LineItemCommand {

    private final String productId;
    private final String variantId;
    private final int quantity;
}
