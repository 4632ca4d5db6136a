package com.freshcart.storefront.common.exception;

/**
 * 다른 판매자 소유의 리소스에 접근할 때 발생하는 예외
 */
public class ForbiddenException extends DomainException {

    public ForbiddenException(String detailMessage) {
        super(ErrorCode.FORBIDDEN, detailMessage);
    }
}
