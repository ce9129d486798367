package com.storemock.commerce.common.exception;

/**
 * DomainException - 도메인 규칙 위반 예외
 *
 * 역할:
 * - 체크아웃/주문 도메인의 규칙 위반 시 발생
 * - 상태 전환 오류, 존재하지 않는 리소스, 재고 부족 등
 * - 일반적으로 클라이언트 오류(4XX)로 응답
 */
public class DomainException extends BizException {

    public DomainException(ErrorCode errorCode) {
        super(errorCode);
    }

    public DomainException(ErrorCode errorCode, Throwable cause) {
        super(errorCode, cause);
    }

    public DomainException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }
}
