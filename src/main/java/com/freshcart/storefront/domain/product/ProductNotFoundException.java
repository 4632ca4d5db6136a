package com.freshcart.storefront.domain.product;

import com.freshcart.storefront.common.exception.DomainException;
import com.freshcart.storefront.common.exception.ErrorCode;

/**
 * 상품을 찾을 수 없을 때 발생하는 예외
 * 존재하지 않는 슬러그뿐 아니라 구매할 수 없는 상품(비활성, 판매 중지, 미승인 판매자)도 포함한다.
 */
public class ProductNotFoundException extends DomainException {

    public ProductNotFoundException(String slug) {
        super(ErrorCode.PRODUCT_NOT_FOUND, String.format("slug: %s", slug));
    }

    public ProductNotFoundException(Long productId) {
        super(ErrorCode.PRODUCT_NOT_FOUND, String.format("ID: %d", productId));
    }
}
