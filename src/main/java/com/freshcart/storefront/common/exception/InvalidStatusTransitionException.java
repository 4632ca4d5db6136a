package com.freshcart.storefront.common.exception;

/**
 * 허용되지 않은 상태 전이를 시도할 때 발생하는 예외
 * (주문 항목 상태, 판매자 승인 상태 공통)
 */
public class InvalidStatusTransitionException extends DomainException {

    private final String from;
    private final String to;

    public InvalidStatusTransitionException(String from, String to) {
        super(ErrorCode.INVALID_STATUS_TRANSITION, String.format("%s → %s", from, to));
        this.from = from;
        this.to = to;
    }

    public String getFrom() {
        return from;
    }

    public String getTo() {
        return to;
    }
}
