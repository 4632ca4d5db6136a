package com.freshcart.storefront.presentation.order.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.freshcart.storefront.domain.order.Order;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 주문 생성 결과 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlaceOrderResponse {
    @JsonProperty("order_id")
    private Long orderId;

    @JsonProperty("total_amount")
    private BigDecimal totalAmount;

    @JsonProperty("item_count")
    private Integer itemCount;

    @JsonProperty("payment_method")
    private String paymentMethod;

    @JsonProperty("delivery_pincode")
    private String deliveryPincode;

    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    public static PlaceOrderResponse from(Order order) {
        return PlaceOrderResponse.builder()
                .orderId(order.getOrderId())
                .totalAmount(order.getTotalAmount())
                .itemCount(order.getOrderItemCount())
                .paymentMethod(order.getPaymentMethod().getValue())
                .deliveryPincode(order.getDeliveryPincode())
                .createdAt(order.getCreatedAt())
                .build();
    }
}
