package com.storemock.commerce.infrastructure.lock;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * KeyedLockManager - 키 단위 프로세스 내부 락
 *
 * 역할:
 * - 키마다 ReentrantLock을 하나씩 관리
 * - 대기/보유 중인 스레드 수를 세어 0이 되면 엔트리 제거 (맵 크기 무제한 증가 방지)
 * - 서로 다른 키끼리는 완전히 독립
 */
@Slf4j
@Component
public class KeyedLockManager {

    private final ConcurrentHashMap<String, LockEntry> locks = new ConcurrentHashMap<>();

    /**
     * 락 획득 시도
     *
     * @return 획득 성공 여부 (false면 대기 시간 초과)
     * @throws InterruptedException 대기 중 인터럽트
     */
    public boolean tryLock(String key, long waitTime, TimeUnit unit) throws InterruptedException {
        LockEntry entry = locks.compute(key, (k, existing) -> {
            LockEntry target = existing == null ? new LockEntry() : existing;
            target.holders++;
            return target;
        });

        boolean acquired = false;
        try {
            acquired = entry.lock.tryLock(waitTime, unit);
            return acquired;
        } finally {
            if (!acquired) {
                release(key, entry);
            }
        }
    }

    /**
     * 락 해제 (현재 스레드가 보유한 경우에만)
     */
    public void unlock(String key) {
        LockEntry entry = locks.get(key);
        if (entry == null || !entry.lock.isHeldByCurrentThread()) {
            log.warn("[KeyedLockManager] 보유하지 않은 락 해제 요청 - key={}", key);
            return;
        }
        entry.lock.unlock();
        release(key, entry);
    }

    /**
     * 현재 관리 중인 키 개수 (테스트/모니터링용)
     */
    public int activeKeyCount() {
        return locks.size();
    }

    private void release(String key, LockEntry entry) {
        locks.computeIfPresent(key, (k, existing) -> {
            if (existing != entry) {
                return existing;
            }
            existing.holders--;
            return existing.holders <= 0 ? null : existing;
        });
    }

    private static final class LockEntry {
        private final ReentrantLock lock = new ReentrantLock();
        private int holders;
    }
}
