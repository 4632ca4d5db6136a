package com.freshcart.storefront.domain.product;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * 상품 등록/수정 시 판매자가 입력하는 값 묶음 (검증 완료된 값)
 */
@Getter
@Builder
@AllArgsConstructor
public class ProductDetails {
    private final String name;
    private final String description;
    private final BigDecimal price;
    private final BigDecimal discountPrice;
    private final Integer quantity;
    private final ProductUnit unit;
    private final Integer lowStockThreshold;
    private final String imageUrl;
    private final boolean available;
}
