package com.freshcart.storefront.domain.cart;

import com.freshcart.storefront.common.exception.DomainException;
import com.freshcart.storefront.common.exception.ErrorCode;

/**
 * 유효하지 않은 수량일 때 발생하는 예외
 */
public class InvalidQuantityException extends DomainException {

    public InvalidQuantityException(Integer quantity) {
        super(ErrorCode.CART_INVALID_QUANTITY, String.format("입력값: %d", quantity));
    }
}
