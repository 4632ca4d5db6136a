package com.freshcart.storefront.presentation.catalog.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.freshcart.storefront.domain.product.Product;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 스토어프론트 상품 카드 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductSummaryResponse {
    @JsonProperty("product_id")
    private Long productId;

    @JsonProperty("slug")
    private String slug;

    @JsonProperty("name")
    private String name;

    @JsonProperty("image_url")
    private String imageUrl;

    @JsonProperty("price")
    private BigDecimal price;

    @JsonProperty("display_price")
    private BigDecimal displayPrice;

    @JsonProperty("has_discount")
    private boolean hasDiscount;

    @JsonProperty("unit")
    private String unit;

    @JsonProperty("in_stock")
    private boolean inStock;

    @JsonProperty("category_id")
    private Long categoryId;

    @JsonProperty("shop_name")
    private String shopName;

    public static ProductSummaryResponse from(Product product, String shopName) {
        return ProductSummaryResponse.builder()
                .productId(product.getProductId())
                .slug(product.getSlug())
                .name(product.getName())
                .imageUrl(product.getImageUrl())
                .price(product.getPrice())
                .displayPrice(product.getDisplayPrice().getAmount())
                .hasDiscount(product.hasDiscount())
                .unit(product.getUnit().getValue())
                .inStock(product.isInStock())
                .categoryId(product.getCategoryId())
                .shopName(shopName)
                .build();
    }
}
