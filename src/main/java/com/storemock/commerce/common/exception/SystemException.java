package com.storemock.commerce.common.exception;

/**
 * SystemException - 시스템 오류 예외
 *
 * 락 획득 실패, 외부 통신 오류, 직렬화 오류 등 클라이언트가 해결할 수 없는 오류에 사용합니다.
 */
public class SystemException extends BizException {

    public SystemException(ErrorCode errorCode) {
        super(errorCode);
    }

    public SystemException(ErrorCode errorCode, Throwable cause) {
        super(errorCode, cause);
    }

    public SystemException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }
}
