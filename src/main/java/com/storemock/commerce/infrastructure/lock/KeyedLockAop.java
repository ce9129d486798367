package com.storemock.commerce.infrastructure.lock;

import com.storemock.commerce.common.exception.ErrorCode;
import com.storemock.commerce.common.exception.SystemException;
import com.storemock.commerce.config.CommerceProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.StandardEvaluationContext;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * 키 단위 락 AOP 처리
 *
 * @KeyedLock 어노테이션이 붙은 메서드 호출 시:
 * 1. 동적 키 생성 (Spring EL)
 * 2. 락 획득 시도 (대기 시간 초과 시 LOCK_ACQUISITION_FAILED)
 * 3. 메서드 실행
 * 4. finally 블록에서 락 해제
 *
 * 같은 체크아웃에 대한 라인 아이템 추가와 할인 적용이 동시에 들어와도
 * subtotal/total 계산이 서로 덮어쓰지 않도록 직렬화합니다.
 */
@Aspect
@Component
@Slf4j
@RequiredArgsConstructor
@Order(Ordered.LOWEST_PRECEDENCE - 1000)
public class KeyedLockAop {

    private final KeyedLockManager lockManager;
    private final CommerceProperties properties;
    private final ExpressionParser expressionParser = new SpelExpressionParser();

    @Around("@annotation(keyedLock)")
    public Object around(ProceedingJoinPoint joinPoint, KeyedLock keyedLock) throws Throwable {
        String dynamicKey = generateKey(joinPoint, keyedLock.key());
        long waitMillis = keyedLock.waitTime() < 0
                ? properties.getLock().getWaitTime().toMillis()
                : keyedLock.timeUnit().toMillis(keyedLock.waitTime());

        boolean lockAcquired;
        try {
            log.debug("[KeyedLock] 락 획득 시도 - key: {}, waitTime: {}ms", dynamicKey, waitMillis);
            lockAcquired = lockManager.tryLock(dynamicKey, waitMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("[KeyedLock] 락 대기 중 스레드 인터럽트 - key: {}", dynamicKey, e);
            throw new SystemException(ErrorCode.LOCK_ACQUISITION_FAILED, e);
        }

        if (!lockAcquired) {
            log.warn("[KeyedLock] 락 획득 실패 - key: {} (waitTime 초과)", dynamicKey);
            throw new SystemException(ErrorCode.LOCK_ACQUISITION_FAILED, "key=" + dynamicKey);
        }

        try {
            return joinPoint.proceed();
        } finally {
            lockManager.unlock(dynamicKey);
            log.debug("[KeyedLock] 락 해제 - key: {}", dynamicKey);
        }
    }

    /**
     * Spring EL을 사용하여 동적 키를 생성합니다.
     * 예: "'checkout:' + #p0" → "checkout:abc" (첫 번째 파라미터가 "abc"일 때)
     */
    private String generateKey(ProceedingJoinPoint joinPoint, String keyPattern) {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Object[] args = joinPoint.getArgs();

        EvaluationContext context = new StandardEvaluationContext();
        for (int i = 0; i < args.length; i++) {
            context.setVariable("p" + i, args[i]);
        }
        context.setVariable("args", args);

        try {
            return expressionParser.parseExpression(keyPattern).getValue(context, String.class);
        } catch (Exception e) {
            log.error("[KeyedLock] 동적 키 생성 실패 - method: {}, pattern: {}",
                    signature.getMethod().getName(), keyPattern, e);
            throw new SystemException(ErrorCode.LOCK_ACQUISITION_FAILED, "invalid key pattern: " + keyPattern);
        }
    }
}
