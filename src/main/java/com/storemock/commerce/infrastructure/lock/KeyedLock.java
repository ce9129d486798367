package com.storemock.commerce.infrastructure.lock;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.util.concurrent.TimeUnit;

/**
 * 키 단위 락 어노테이션
 *
 * 메서드에 붙여서 같은 키(예: 체크아웃 ID)에 대한 동시 실행을 직렬화합니다.
 * Spring EL을 지원하므로 메서드 파라미터를 동적 키로 사용할 수 있습니다.
 *
 * 예제:
 * @KeyedLock(key = LockKeyGenerator.CHECKOUT_KEY_TEMPLATE)
 * public CheckoutResult addLineItem(String checkoutId, AddLineItemCommand command) { ... }
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface KeyedLock {

    /**
     * 락 키 (Spring EL)
     * - #p0, #p1, ... : 메서드 파라미터 (위치 기반)
     */
    String key();

    /**
     * 락 획득 대기 시간
     * 0 미만이면 commerce.lock.wait-time 설정값을 사용합니다.
     */
    long waitTime() default -1;

    TimeUnit timeUnit() default TimeUnit.MILLISECONDS;
}
