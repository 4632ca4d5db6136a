package com.freshcart.storefront.common.exception;

/**
 * SystemException - 시스템 오류 예외
 *
 * 데이터베이스 장애 등 인프라 계층의 오류를 감싼다.
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
