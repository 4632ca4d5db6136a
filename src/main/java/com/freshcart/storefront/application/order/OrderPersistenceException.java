package com.freshcart.storefront.application.order;

import com.freshcart.storefront.common.exception.ApplicationException;
import com.freshcart.storefront.common.exception.ErrorCode;

/**
 * 주문 저장 트랜잭션 실패 예외
 * 트랜잭션은 롤백되었으며 장바구니는 변경되지 않은 상태다.
 */
public class OrderPersistenceException extends ApplicationException {

    private final Long userId;

    public OrderPersistenceException(Long userId, Throwable cause) {
        super(ErrorCode.ORDER_PERSISTENCE_FAILED, cause);
        this.userId = userId;
    }

    public Long getUserId() {
        return userId;
    }
}
