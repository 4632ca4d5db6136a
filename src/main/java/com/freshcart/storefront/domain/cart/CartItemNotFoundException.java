package com.freshcart.storefront.domain.cart;

import com.freshcart.storefront.common.exception.DomainException;
import com.freshcart.storefront.common.exception.ErrorCode;

/**
 * 장바구니 아이템이 없거나 다른 사용자의 장바구니에 속할 때 발생하는 예외
 */
public class CartItemNotFoundException extends DomainException {

    public CartItemNotFoundException(Long cartItemId) {
        super(ErrorCode.CART_ITEM_NOT_FOUND, String.format("ID: %d", cartItemId));
    }
}
