package com.storemock.commerce.application.checkout.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 일반 업데이트의 라인 아이템 수량 변경 (0 이하이면 삭제)
 */
@Getter
@AllArgsConstructor
public class LineItemQuantityCommand {

    private final String lineItemId;
    private final int quantity;
}
