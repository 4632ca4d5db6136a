package com.freshcart.storefront.presentation.order.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 결제(주문 생성) 요청 DTO
 * 검증은 CheckoutValidator에서 모든 필드를 한 번에 수행한다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckoutRequest {
    @JsonProperty("name")
    private String name;

    @JsonProperty("phone")
    private String phone;

    @JsonProperty("address")
    private String address;

    @JsonProperty("payment_method")
    private String paymentMethod;
}
