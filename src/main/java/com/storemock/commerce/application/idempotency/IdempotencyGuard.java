package com.storemock.commerce.application.idempotency;

import com.github.benmanes.caffeine.cache.Cache;
import com.storemock.commerce.common.exception.ErrorCode;
import com.storemock.commerce.common.exception.SystemException;
import com.storemock.commerce.config.CommerceProperties;
import com.storemock.commerce.infrastructure.lock.KeyedLockManager;
import com.storemock.commerce.infrastructure.lock.LockKeyGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * IdempotencyGuard - Idempotency-Key 기반 중복 실행 방지
 *
 * 처리 규칙:
 * - 키 없음 → 그대로 실행, 저장하지 않음
 * - 처음 보는 키 → 실행 후 (요청 해시, 응답) 저장
 * - 같은 키 + 같은 해시 → 저장된 응답 반환 (재실행 없음)
 * - 같은 키 + 다른 해시 → IdempotencyConflictException
 *
 * 확인 → 실행 → 저장은 키 단위 락 안에서 수행됩니다.
 * 실행 중 예외가 나면 저장하지 않으므로 같은 키로 재시도할 수 있습니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IdempotencyGuard {

    private final Cache<String, IdempotencyRecord> idempotencyStore;
    private final RequestFingerprint requestFingerprint;
    private final KeyedLockManager lockManager;
    private final CommerceProperties properties;

    public IdempotentResponse execute(String idempotencyKey, Object payload, Supplier<IdempotentResponse> operation) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            return operation.get();
        }

        String requestHash = requestFingerprint.hash(payload);
        String lockKey = LockKeyGenerator.idempotency(idempotencyKey);
        acquire(lockKey);
        try {
            IdempotencyRecord existing = idempotencyStore.getIfPresent(idempotencyKey);
            if (existing != null) {
                if (!existing.matches(requestHash)) {
                    log.warn("[IdempotencyGuard] 멱등성 키 충돌 - key={}", idempotencyKey);
                    throw new IdempotencyConflictException(idempotencyKey);
                }
                log.debug("[IdempotencyGuard] 저장된 응답 반환 - key={}", idempotencyKey);
                return existing.getResponse();
            }

            IdempotentResponse response = operation.get();
            idempotencyStore.put(idempotencyKey, new IdempotencyRecord(requestHash, response));
            return response;
        } finally {
            lockManager.unlock(lockKey);
        }
    }

    private void acquire(String lockKey) {
        long waitMillis = properties.getLock().getWaitTime().toMillis();
        try {
            if (!lockManager.tryLock(lockKey, waitMillis, TimeUnit.MILLISECONDS)) {
                throw new SystemException(ErrorCode.LOCK_ACQUISITION_FAILED, "key=" + lockKey);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SystemException(ErrorCode.LOCK_ACQUISITION_FAILED, e);
        }
    }
}
