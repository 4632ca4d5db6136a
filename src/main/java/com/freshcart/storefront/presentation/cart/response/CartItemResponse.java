package com.freshcart.storefront.presentation.cart.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.freshcart.storefront.domain.cart.CartItem;
import com.freshcart.storefront.domain.common.vo.Money;
import com.freshcart.storefront.domain.product.Product;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 장바구니 라인 응답 DTO
 * 가격은 조회 시점의 상품 표시 가격으로 계산된다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartItemResponse {
    @JsonProperty("cart_item_id")
    private Long cartItemId;

    @JsonProperty("product_id")
    private Long productId;

    @JsonProperty("product_slug")
    private String productSlug;

    @JsonProperty("product_name")
    private String productName;

    @JsonProperty("image_url")
    private String imageUrl;

    @JsonProperty("unit_price")
    private BigDecimal unitPrice;

    @JsonProperty("shop_name")
    private String shopName;

    @JsonProperty("quantity")
    private Integer quantity;

    @JsonProperty("line_total")
    private BigDecimal lineTotal;

    public static CartItemResponse from(CartItem item, Product product, String shopName) {
        Money unitPrice = product.getDisplayPrice();
        return CartItemResponse.builder()
                .cartItemId(item.getCartItemId())
                .productId(product.getProductId())
                .productSlug(product.getSlug())
                .productName(product.getName())
                .imageUrl(product.getImageUrl())
                .unitPrice(unitPrice.getAmount())
                .shopName(shopName)
                .quantity(item.getQuantity())
                .lineTotal(unitPrice.multiply(item.getQuantity()).getAmount())
                .build();
    }
}
