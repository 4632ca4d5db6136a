package com.freshcart.storefront.presentation.order.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.freshcart.storefront.domain.order.OrderItem;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 주문 항목 응답 DTO (고객 주문 조회용)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderItemResponse {
    @JsonProperty("order_item_id")
    private Long orderItemId;

    @JsonProperty("product_id")
    private Long productId;

    @JsonProperty("product_name")
    private String productName;

    @JsonProperty("vendor_id")
    private Long vendorId;

    @JsonProperty("quantity")
    private Integer quantity;

    @JsonProperty("unit_price")
    private BigDecimal unitPrice;

    @JsonProperty("line_total")
    private BigDecimal lineTotal;

    @JsonProperty("status")
    private String status;

    @JsonProperty("status_changed_at")
    private LocalDateTime statusChangedAt;

    public static OrderItemResponse from(OrderItem item) {
        return OrderItemResponse.builder()
                .orderItemId(item.getOrderItemId())
                .productId(item.getProductId())
                .productName(item.getProductName())
                .vendorId(item.getVendorId())
                .quantity(item.getQuantity())
                .unitPrice(item.getUnitPrice())
                .lineTotal(item.getLineTotal().getAmount())
                .status(item.getStatus().name())
                .statusChangedAt(item.getStatusChangedAt())
                .build();
    }
}
