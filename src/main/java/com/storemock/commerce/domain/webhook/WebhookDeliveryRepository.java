package com.storemock.commerce.domain.webhook;

import java.util.List;

/**
 * WebhookDeliveryRepository - 웹훅 전송 이력 저장소 인터페이스 (Port)
 * 구현체는 최근 N건만 보관합니다.
 */
public interface WebhookDeliveryRepository {

    WebhookDelivery save(WebhookDelivery delivery);

    List<WebhookDelivery> findByOrderId(String orderId);

    List<WebhookDelivery> findAll();
}
