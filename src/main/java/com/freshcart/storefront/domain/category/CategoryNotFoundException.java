package com.freshcart.storefront.domain.category;

import com.freshcart.storefront.common.exception.DomainException;
import com.freshcart.storefront.common.exception.ErrorCode;

/**
 * 카테고리를 찾을 수 없거나 비활성 상태일 때 발생하는 예외
 */
public class CategoryNotFoundException extends DomainException {

    public CategoryNotFoundException(String slug) {
        super(ErrorCode.CATEGORY_NOT_FOUND, String.format("slug: %s", slug));
    }

    public CategoryNotFoundException(Long categoryId) {
        super(ErrorCode.CATEGORY_NOT_FOUND, String.format("ID: %d", categoryId));
    }
}
