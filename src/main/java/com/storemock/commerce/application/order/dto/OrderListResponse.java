package com.storemock.commerce.application.order.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 주문 목록 조회 응답 {orders, total}
 * total은 현재 페이지에 포함된 주문 수입니다.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class OrderListResponse {

    private List<OrderResponse> orders;
    private int total;
}
