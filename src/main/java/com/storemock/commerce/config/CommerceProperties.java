package com.storemock.commerce.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * 체크아웃 서비스 외부 설정 프로퍼티 (prefix: commerce)
 *
 * application.yml 값이 타입 안전하게 바인딩됩니다.
 * - payment: 결제 핸들러 ID, 실패 유도용 결제수단 ID
 * - idempotency: 멱등성 캐시 크기/TTL
 * - lock: 체크아웃 락 대기 시간
 * - webhook: 타임아웃, 프로필 캐시, 전송 이력, 전용 스레드풀 크기
 * - simulation: 배송 시뮬레이션 보호용 시크릿 (빈 값이면 검증 생략)
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "commerce")
public class CommerceProperties {

    @NotBlank
    private String publicBaseUrl = "http://localhost:8080";

    @NotNull @Valid
    private Payment payment = new Payment();

    @NotNull @Valid
    private Idempotency idempotency = new Idempotency();

    @NotNull @Valid
    private Lock lock = new Lock();

    @NotNull @Valid
    private Webhook webhook = new Webhook();

    @NotNull @Valid
    private Simulation simulation = new Simulation();

    @Getter
    @Setter
    public static class Payment {
        @NotBlank
        private String failureInstrumentId = "instr_fail";

        @NotBlank
        private String handlerId = "mock_payment_handler";
    }

    @Getter
    @Setter
    public static class Idempotency {
        @Min(1)
        private long maxEntries = 10_000;

        @NotNull
        private Duration ttl = Duration.ofHours(24);
    }

    @Getter
    @Setter
    public static class Lock {
        @NotNull
        private Duration waitTime = Duration.ofSeconds(5);
    }

    @Getter
    @Setter
    public static class Webhook {
        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(10);

        @NotNull
        private Duration readTimeout = Duration.ofSeconds(10);

        @Min(1)
        private long profileCacheSize = 256;

        @NotNull
        private Duration profileCacheTtl = Duration.ofMinutes(10);

        @Min(1)
        private int deliveryLogSize = 1000;

        @Min(1)
        private int corePoolSize = 2;

        @Min(1)
        private int maxPoolSize = 8;

        @Min(0)
        private int queueCapacity = 500;
    }

    @Getter
    @Setter
    public static class Simulation {
        private String secret = "";

        public boolean isSecretConfigured() {
            return secret != null && !secret.isBlank();
        }
    }
}
