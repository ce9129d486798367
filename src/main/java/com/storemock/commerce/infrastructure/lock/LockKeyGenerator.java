package com.storemock.commerce.infrastructure.lock;

/**
 * 락 키 생성 유틸리티
 *
 * 패턴: resource_type:resource_id
 *
 * 사용 예:
 * - @KeyedLock(key = LockKeyGenerator.CHECKOUT_KEY_TEMPLATE)
 * - String lockKey = LockKeyGenerator.idempotency(idempotencyKey);
 */
public final class LockKeyGenerator {

    // ============ Spring EL 템플릿 (어노테이션용) ============

    /**
     * 체크아웃 변경용 락 키 템플릿
     * 예: addLineItem(checkoutId="abc", ...) → "checkout:abc"
     */
    public static final String CHECKOUT_KEY_TEMPLATE = "'checkout:' + #p0";

    /**
     * 주문 변경용 락 키 템플릿
     * 예: cancelOrder(orderId="xyz") → "order:xyz"
     */
    public static final String ORDER_KEY_TEMPLATE = "'order:' + #p0";

    // ============ 프로그래밍 방식 ============

    public static String checkout(String checkoutId) {
        return "checkout:" + checkoutId;
    }

    public static String idempotency(String idempotencyKey) {
        return "idempotency:" + idempotencyKey;
    }

    private LockKeyGenerator() {
    }
}
