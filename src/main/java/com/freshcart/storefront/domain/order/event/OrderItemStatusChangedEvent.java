package com.freshcart.storefront.domain.order.event;

import com.freshcart.storefront.domain.order.OrderItemStatus;
import lombok.Getter;
import lombok.ToString;
import org.springframework.context.ApplicationEvent;

import java.time.LocalDateTime;

/**
 * 주문 항목 상태 변경 이벤트
 * 판매자가 주문 항목 상태를 변경하고 트랜잭션이 커밋된 후 고객 알림에 사용된다.
 */
@Getter
@ToString
public class OrderItemStatusChangedEvent extends ApplicationEvent {

    private final Long orderItemId;
    private final Long orderId;
    private final Long customerUserId;
    private final String productName;
    private final String shopName;
    private final OrderItemStatus previousStatus;
    private final OrderItemStatus newStatus;
    private final LocalDateTime occurredAt;

    public OrderItemStatusChangedEvent(Long orderItemId, Long orderId, Long customerUserId,
                                       String productName, String shopName,
                                       OrderItemStatus previousStatus, OrderItemStatus newStatus,
                                       LocalDateTime occurredAt) {
        super(orderItemId);
        this.orderItemId = orderItemId;
        this.orderId = orderId;
        this.customerUserId = customerUserId;
        this.productName = productName;
        this.shopName = shopName;
        this.previousStatus = previousStatus;
        this.newStatus = newStatus;
        this.occurredAt = occurredAt;
    }
}
