package com.freshcart.storefront.domain.cart;

import com.freshcart.storefront.common.exception.DomainException;
import com.freshcart.storefront.common.exception.ErrorCode;

/**
 * 빈 장바구니로 결제를 시도할 때 발생하는 예외
 */
public class EmptyCartException extends DomainException {

    public EmptyCartException(Long userId) {
        super(ErrorCode.CART_EMPTY, String.format("userId: %d", userId));
    }
}
