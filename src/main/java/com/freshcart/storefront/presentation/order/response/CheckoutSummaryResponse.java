package com.freshcart.storefront.presentation.order.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.freshcart.storefront.presentation.cart.response.CartResponse;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 결제 화면 응답 DTO (장바구니 + 저장된 배송 우편번호 + 결제 수단)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckoutSummaryResponse {
    @JsonProperty("cart")
    private CartResponse cart;

    @JsonProperty("delivery_pincode")
    private String deliveryPincode;

    @JsonProperty("payment_methods")
    private List<String> paymentMethods;
}
