package com.freshcart.storefront.domain.user;

import com.freshcart.storefront.common.exception.DomainException;
import com.freshcart.storefront.common.exception.ErrorCode;

/**
 * 사용자를 찾을 수 없을 때 발생하는 예외
 */
public class UserNotFoundException extends DomainException {

    public UserNotFoundException(Long userId) {
        super(ErrorCode.USER_NOT_FOUND, String.format("ID: %d", userId));
    }
}
