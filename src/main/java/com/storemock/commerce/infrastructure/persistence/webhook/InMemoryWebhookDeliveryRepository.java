package com.storemock.commerce.infrastructure.persistence.webhook;

import com.storemock.commerce.config.CommerceProperties;
import com.storemock.commerce.domain.webhook.WebhookDelivery;
import com.storemock.commerce.domain.webhook.WebhookDeliveryRepository;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.stream.Collectors;

/**
 * InMemoryWebhookDeliveryRepository - 웹훅 전송 이력 (인메모리, 최근 N건)
 *
 * 보관 한도(commerce.webhook.delivery-log-size)를 넘으면 가장 오래된 기록부터 버립니다.
 */
@Repository
public class InMemoryWebhookDeliveryRepository implements WebhookDeliveryRepository {

    private final Deque<WebhookDelivery> deliveries = new ArrayDeque<>();
    private final int capacity;

    public InMemoryWebhookDeliveryRepository(CommerceProperties properties) {
        this.capacity = properties.getWebhook().getDeliveryLogSize();
    }

    @Override
    public synchronized WebhookDelivery save(WebhookDelivery delivery) {
        if (deliveries.size() >= capacity) {
            deliveries.pollFirst();
        }
        deliveries.addLast(delivery);
        return delivery;
    }

    @Override
    public synchronized List<WebhookDelivery> findByOrderId(String orderId) {
        return deliveries.stream()
                .filter(delivery -> orderId.equals(delivery.getOrderId()))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<WebhookDelivery> findAll() {
        return new ArrayList<>(deliveries);
    }
}
