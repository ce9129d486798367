package com.storemock.commerce.common.exception;

/**
 * ApplicationException - 유스케이스 처리 실패 예외
 *
 * 사용 예:
 * - 멱등성 키 충돌 (같은 키, 다른 요청 본문)
 * - 결제 실패 (테스트용 실패 결제수단)
 * - 시뮬레이션 인증 실패
 */
public class ApplicationException extends BizException {

    public ApplicationException(ErrorCode errorCode) {
        super(errorCode);
    }

    public ApplicationException(ErrorCode errorCode, Throwable cause) {
        super(errorCode, cause);
    }

    public ApplicationException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }
}
