package com.freshcart.storefront.domain.order;

import com.freshcart.storefront.common.exception.DomainException;
import com.freshcart.storefront.common.exception.ErrorCode;

/**
 * 주문 항목을 찾을 수 없을 때 발생하는 예외
 */
public class OrderItemNotFoundException extends DomainException {

    public OrderItemNotFoundException(Long orderItemId) {
        super(ErrorCode.ORDER_ITEM_NOT_FOUND, String.format("ID: %d", orderItemId));
    }
}
