package com.storemock.commerce.domain.checkout;

import lombok.Getter;

import java.util.Map;

/**
 * CheckoutStatus - 체크아웃 생명주기 상태
 *
 * 상태 전환 규칙:
 * INCOMPLETE → COMPLETED (주문 생성)
 * INCOMPLETE → CANCELED
 * COMPLETED, CANCELED는 종료 상태이며 이후 모든 변경 요청을 거부합니다.
 *
 * 외부 표기:
 * - 레거시 값 in_progress, active는 incomplete로 노출
 * - cancelled, canceled 철자는 canceled로 통일
 */
@Getter
public enum CheckoutStatus {
    INCOMPLETE("incomplete"),
    REQUIRES_ESCALATION("requires_escalation"),
    READY_FOR_COMPLETE("ready_for_complete"),
    COMPLETE_IN_PROGRESS("complete_in_progress"),
    COMPLETED("completed"),
    CANCELED("canceled");

    private static final Map<String, CheckoutStatus> ALIASES = Map.of(
            "in_progress", INCOMPLETE,
            "active", INCOMPLETE,
            "cancelled", CANCELED
    );

    private final String value;

    CheckoutStatus(String value) {
        this.value = value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELED;
    }

    public boolean isMutable() {
        return this == INCOMPLETE;
    }

    /**
     * 외부/레거시 표기에서 상태로 변환
     * 알 수 없는 값은 INCOMPLETE로 간주합니다.
     */
    public static CheckoutStatus fromValue(String value) {
        if (value == null) {
            return INCOMPLETE;
        }
        String normalized = value.trim().toLowerCase();
        CheckoutStatus alias = ALIASES.get(normalized);
        if (alias != null) {
            return alias;
        }
        for (CheckoutStatus status : values()) {
            if (status.value.equals(normalized)) {
                return status;
            }
        }
        return INCOMPLETE;
    }

    /**
     * 저장된 상태 문자열을 응답용 표기로 변환
     */
    public static String toExternal(String storedValue) {
        return fromValue(storedValue).getValue();
    }
}
