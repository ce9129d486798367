package com.storemock.commerce.application.webhook;

import com.storemock.commerce.domain.order.event.CheckoutCompletedEvent;
import com.storemock.commerce.domain.order.event.OrderShippedEvent;
import com.storemock.commerce.domain.webhook.WebhookEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

/**
 * WebhookEventListener - 주문 이벤트를 웹훅 전송으로 연결
 *
 * 역할:
 * - CheckoutCompletedEvent → order_placed
 * - OrderShippedEvent → order_shipped
 *
 * 전송은 webhookExecutor에서 비동기로 실행되며, 실행기 큐가 가득 차서
 * 거부되더라도 요청 처리에는 영향을 주지 않습니다 (로깅만 수행).
 */
@Component
public class WebhookEventListener {

    private static final Logger log = LoggerFactory.getLogger(WebhookEventListener.class);

    private final WebhookNotifier webhookNotifier;

    public WebhookEventListener(WebhookNotifier webhookNotifier) {
        this.webhookNotifier = webhookNotifier;
    }

    @EventListener
    public void handleCheckoutCompleted(CheckoutCompletedEvent event) {
        log.info("[WebhookEventListener] 주문 생성 이벤트 수신 - checkoutId={}, orderId={}",
                event.getCheckoutId(), event.getOrderId());
        dispatch(WebhookEventType.ORDER_PLACED, event.getOrderId(), event.getAgentReference());
    }

    @EventListener
    public void handleOrderShipped(OrderShippedEvent event) {
        log.info("[WebhookEventListener] 주문 배송 이벤트 수신 - orderId={}", event.getOrderId());
        dispatch(WebhookEventType.ORDER_SHIPPED, event.getOrderId(), event.getAgentReference());
    }

    private void dispatch(WebhookEventType eventType, String orderId, String agentReference) {
        try {
            webhookNotifier.dispatch(eventType, orderId, agentReference);
        } catch (TaskRejectedException e) {
            log.error("[WebhookEventListener] 웹훅 전송 작업 거부 - orderId={}, eventType={}, error={}",
                    orderId, eventType.getValue(), e.getMessage());
        }
    }
}
