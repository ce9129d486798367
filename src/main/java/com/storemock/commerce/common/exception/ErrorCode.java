package com.storemock.commerce.common.exception;

/**
 * ErrorCode - 비즈니스 예외 코드 정의
 *
 * 역할:
 * - 모든 비즈니스 예외의 코드와 메시지 정의
 * - HTTP 상태 코드 및 ErrorKind 매핑
 *
 * 코드 형식: {LAYER}_{DOMAIN}_{ERROR}
 * 예: DOMAIN_CHECKOUT_NOT_FOUND, APP_IDEMPOTENCY_CONFLICT
 */
public enum ErrorCode {

    // ========== Domain Layer Errors (4XX) ==========

    // Checkout Domain
    CHECKOUT_NOT_FOUND("DOMAIN_CHECKOUT_NOT_FOUND", "체크아웃을 찾을 수 없습니다", 404, ErrorKind.NOT_FOUND),
    LINE_ITEM_NOT_FOUND("DOMAIN_CHECKOUT_LINE_ITEM_NOT_FOUND", "라인 아이템을 찾을 수 없습니다", 404, ErrorKind.NOT_FOUND),
    INVALID_CHECKOUT_STATUS("DOMAIN_CHECKOUT_INVALID_STATUS", "현재 체크아웃 상태에서 허용되지 않는 요청입니다", 409, ErrorKind.INVALID_STATE),
    EMPTY_CHECKOUT("DOMAIN_CHECKOUT_EMPTY", "라인 아이템이 없는 체크아웃은 완료할 수 없습니다", 400, ErrorKind.VALIDATION_ERROR),
    INVALID_REQUEST("DOMAIN_CHECKOUT_INVALID_REQUEST", "유효하지 않은 요청입니다", 400, ErrorKind.VALIDATION_ERROR),

    // Product Domain
    PRODUCT_NOT_FOUND("DOMAIN_PRODUCT_NOT_FOUND", "상품을 찾을 수 없습니다", 400, ErrorKind.VALIDATION_ERROR),
    INSUFFICIENT_STOCK("DOMAIN_PRODUCT_INSUFFICIENT_STOCK", "재고가 부족합니다", 400, ErrorKind.VALIDATION_ERROR),
    INVALID_QUANTITY("DOMAIN_PRODUCT_INVALID_QUANTITY", "유효하지 않은 수량입니다", 400, ErrorKind.VALIDATION_ERROR),

    // Discount Domain
    INVALID_DISCOUNT_CODE("DOMAIN_DISCOUNT_INVALID_CODE", "유효하지 않은 할인 코드입니다", 400, ErrorKind.VALIDATION_ERROR),

    // Fulfillment Domain
    INVALID_FULFILLMENT_METHOD("DOMAIN_FULFILLMENT_INVALID_METHOD", "유효하지 않은 배송 방법입니다", 400, ErrorKind.VALIDATION_ERROR),
    FULFILLMENT_REQUIRED("DOMAIN_FULFILLMENT_REQUIRED", "배송지와 배송 옵션을 선택해야 합니다", 400, ErrorKind.FULFILLMENT_REQUIRED),

    // Order Domain
    ORDER_NOT_FOUND("DOMAIN_ORDER_NOT_FOUND", "주문을 찾을 수 없습니다", 404, ErrorKind.NOT_FOUND),
    INVALID_ORDER_STATUS("DOMAIN_ORDER_INVALID_STATUS", "취소할 수 없는 주문 상태입니다", 400, ErrorKind.INVALID_STATE),

    // ========== Application Layer Errors ==========

    PAYMENT_FAILED("APP_PAYMENT_FAILED", "결제에 실패했습니다", 402, ErrorKind.PAYMENT_FAILURE),
    IDEMPOTENCY_CONFLICT("APP_IDEMPOTENCY_CONFLICT", "같은 멱등성 키로 다른 요청이 들어왔습니다", 409, ErrorKind.IDEMPOTENCY_CONFLICT),
    SIMULATION_FORBIDDEN("APP_SIMULATION_FORBIDDEN", "시뮬레이션 시크릿이 올바르지 않습니다", 403, ErrorKind.FORBIDDEN),

    // ========== System Errors (5XX) ==========

    LOCK_ACQUISITION_FAILED("SYSTEM_LOCK_ACQUISITION_FAILED", "락 획득에 실패했습니다", 503, ErrorKind.SYSTEM),
    SERIALIZATION_FAILED("SYSTEM_SERIALIZATION_FAILED", "요청 직렬화에 실패했습니다", 500, ErrorKind.SYSTEM),
    AGENT_PROFILE_UNAVAILABLE("SYSTEM_AGENT_PROFILE_UNAVAILABLE", "에이전트 프로필을 가져올 수 없습니다", 502, ErrorKind.SYSTEM),
    INTERNAL_ERROR("SYSTEM_INTERNAL_ERROR", "서버 내부 오류가 발생했습니다", 500, ErrorKind.SYSTEM);

    private final String code;
    private final String message;
    private final int statusCode;
    private final ErrorKind kind;

    ErrorCode(String code, String message, int statusCode, ErrorKind kind) {
        this.code = code;
        this.message = message;
        this.statusCode = statusCode;
        this.kind = kind;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
