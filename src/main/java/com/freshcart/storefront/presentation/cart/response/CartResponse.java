package com.freshcart.storefront.presentation.cart.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * 장바구니 조회 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartResponse {
    @JsonProperty("cart_id")
    private Long cartId;

    @JsonProperty("user_id")
    private Long userId;

    @JsonProperty("items")
    private List<CartItemResponse> items;

    @JsonProperty("total_items")
    private Integer totalItems;

    @JsonProperty("total_price")
    private BigDecimal totalPrice;

    public boolean isEmpty() {
        return items == null || items.isEmpty();
    }
}
