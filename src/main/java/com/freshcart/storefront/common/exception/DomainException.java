package com.freshcart.storefront.common.exception;

/**
 * DomainException - 도메인 규칙 위반 예외
 *
 * 입력값 검증 실패, 상태 전이 오류, 소유권 위반 등
 * 클라이언트 오류(4XX)로 응답한다.
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
