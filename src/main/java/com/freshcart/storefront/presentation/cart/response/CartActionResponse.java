package com.freshcart.storefront.presentation.cart.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 장바구니 변경(담기/수량 변경/삭제) 결과 응답 DTO
 * 항목이 삭제된 경우 cart_item_id와 quantity는 생략된다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CartActionResponse {
    @JsonProperty("cart_item_id")
    private Long cartItemId;

    @JsonProperty("product_name")
    private String productName;

    @JsonProperty("quantity")
    private Integer quantity;

    @JsonProperty("removed")
    private boolean removed;

    @JsonProperty("message")
    private String message;
}
