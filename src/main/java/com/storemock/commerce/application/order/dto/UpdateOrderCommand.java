package com.storemock.commerce.application.order.dto;

import com.storemock.commerce.domain.order.FulfillmentEvent;
import com.storemock.commerce.domain.order.OrderAdjustment;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * 주문 업데이트 명령 (배송 이벤트/조정 내역 추가, 상태 변경)
 * null 필드는 변경 없음
 */
@Getter
@Builder
@AllArgsConstructor
public class UpdateOrderCommand {

    private final List<FulfillmentEvent> events;
    private final List<OrderAdjustment> adjustments;
    private final String status;
}
