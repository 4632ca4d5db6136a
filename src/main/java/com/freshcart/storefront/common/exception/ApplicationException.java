package com.freshcart.storefront.common.exception;

/**
 * ApplicationException - 유스케이스 처리 실패 예외
 *
 * 여러 도메인을 조합하는 애플리케이션 서비스에서
 * 처리를 완료하지 못했을 때 발생한다. (예: 주문 저장 실패)
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
