package com.storemock.commerce.application.webhook;

import com.storemock.commerce.application.order.OrderResponseAssembler;
import com.storemock.commerce.common.exception.BizException;
import com.storemock.commerce.config.AsyncConfig;
import com.storemock.commerce.domain.order.Order;
import com.storemock.commerce.domain.order.OrderRepository;
import com.storemock.commerce.domain.webhook.DeliveryOutcome;
import com.storemock.commerce.domain.webhook.WebhookDelivery;
import com.storemock.commerce.domain.webhook.WebhookDeliveryRepository;
import com.storemock.commerce.domain.webhook.WebhookEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * WebhookNotifier - 주문 이벤트 웹훅 전송
 *
 * 역할:
 * - 에이전트 프로필에서 웹훅 URL을 찾아 {event_type, checkout_id, order, timestamp} POST
 * - 모든 시도(성공, 실패, 생략)를 전송 이력에 기록하고 로깅
 *
 * 전송 규칙:
 * - 재시도 없음
 * - 어떤 실패도 호출 측(요청 처리)으로 전파하지 않음
 */
@Slf4j
@Component
public class WebhookNotifier {

    private final AgentProfileClient agentProfileClient;
    private final OrderRepository orderRepository;
    private final OrderResponseAssembler orderResponseAssembler;
    private final WebhookDeliveryRepository deliveryRepository;
    private final RestTemplate webhookRestTemplate;

    public WebhookNotifier(AgentProfileClient agentProfileClient,
                           OrderRepository orderRepository,
                           OrderResponseAssembler orderResponseAssembler,
                           WebhookDeliveryRepository deliveryRepository,
                           RestTemplate webhookRestTemplate) {
        this.agentProfileClient = agentProfileClient;
        this.orderRepository = orderRepository;
        this.orderResponseAssembler = orderResponseAssembler;
        this.deliveryRepository = deliveryRepository;
        this.webhookRestTemplate = webhookRestTemplate;
    }

    /**
     * 웹훅 전송 비동기 실행 (webhookExecutor)
     * 반환된 Future를 취소해도 이미 시작된 전송은 중단되지 않습니다.
     */
    @Async(AsyncConfig.WEBHOOK_EXECUTOR)
    public CompletableFuture<WebhookDelivery> dispatch(WebhookEventType eventType, String orderId, String agentReference) {
        return CompletableFuture.completedFuture(deliver(eventType, orderId, agentReference));
    }

    /**
     * 웹훅 전송 (동기) 및 결과 기록
     */
    public WebhookDelivery deliver(WebhookEventType eventType, String orderId, String agentReference) {
        Optional<Order> order = orderRepository.findById(orderId);
        if (order.isEmpty()) {
            return record(eventType, orderId, null, null, DeliveryOutcome.SKIPPED, null, "order not found");
        }
        String checkoutId = order.get().getCheckoutId();

        String webhookUrl;
        try {
            webhookUrl = agentProfileClient.resolveWebhookUrl(agentReference).orElse(null);
        } catch (BizException e) {
            log.warn("[WebhookNotifier] 에이전트 프로필 조회 실패 - orderId={}, agent={}, error={}",
                    orderId, agentReference, e.getMessage());
            return record(eventType, orderId, checkoutId, null, DeliveryOutcome.SKIPPED, null, e.getMessage());
        }
        if (webhookUrl == null) {
            log.debug("[WebhookNotifier] 웹훅 URL 없음 - orderId={}, eventType={}", orderId, eventType.getValue());
            return record(eventType, orderId, checkoutId, null, DeliveryOutcome.SKIPPED, null, "no webhook url");
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event_type", eventType.getValue());
        payload.put("checkout_id", checkoutId);
        payload.put("order", orderResponseAssembler.toResponse(order.get()));
        payload.put("timestamp", Instant.now().toString());

        try {
            ResponseEntity<Void> response = webhookRestTemplate.postForEntity(webhookUrl, payload, Void.class);
            int status = response.getStatusCode().value();
            if (response.getStatusCode().is2xxSuccessful()) {
                log.info("[WebhookNotifier] 웹훅 전송 성공 - orderId={}, eventType={}, status={}",
                        orderId, eventType.getValue(), status);
                return record(eventType, orderId, checkoutId, webhookUrl, DeliveryOutcome.DELIVERED, status, null);
            }
            log.error("[WebhookNotifier] 웹훅 전송 실패 - orderId={}, eventType={}, status={}",
                    orderId, eventType.getValue(), status);
            return record(eventType, orderId, checkoutId, webhookUrl, DeliveryOutcome.FAILED, status, null);
        } catch (RestClientResponseException e) {
            log.error("[WebhookNotifier] 웹훅 전송 실패 - orderId={}, eventType={}, status={}",
                    orderId, eventType.getValue(), e.getStatusCode().value());
            return record(eventType, orderId, checkoutId, webhookUrl, DeliveryOutcome.FAILED,
                    e.getStatusCode().value(), e.getMessage());
        } catch (RestClientException e) {
            log.error("[WebhookNotifier] 웹훅 전송 오류 - orderId={}, eventType={}, error={}",
                    orderId, eventType.getValue(), e.getMessage());
            return record(eventType, orderId, checkoutId, webhookUrl, DeliveryOutcome.FAILED, null, e.getMessage());
        }
    }

    private WebhookDelivery record(WebhookEventType eventType, String orderId, String checkoutId, String webhookUrl,
                                   DeliveryOutcome outcome, Integer httpStatus, String errorMessage) {
        WebhookDelivery delivery = WebhookDelivery.builder()
                .deliveryId("whd_" + UUID.randomUUID().toString().substring(0, 12))
                .eventType(eventType)
                .orderId(orderId)
                .checkoutId(checkoutId)
                .webhookUrl(webhookUrl)
                .outcome(outcome)
                .httpStatus(httpStatus)
                .errorMessage(errorMessage)
                .attemptedAt(Instant.now())
                .build();
        return deliveryRepository.save(delivery);
    }
}
