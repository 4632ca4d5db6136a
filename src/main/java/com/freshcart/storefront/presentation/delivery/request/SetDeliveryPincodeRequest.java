package com.freshcart.storefront.presentation.delivery.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 배송 우편번호 저장 요청 DTO
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class SetDeliveryPincodeRequest {
    @JsonProperty("pincode")
    private String pincode;
}
