package com.freshcart.storefront.presentation.delivery.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 배송 가능 여부 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeliveryAvailabilityResponse {
    @JsonProperty("available")
    private boolean available;

    @JsonProperty("pincode")
    private String pincode;

    @JsonProperty("message")
    private String message;
}
