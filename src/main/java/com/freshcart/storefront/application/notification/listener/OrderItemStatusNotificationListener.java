package com.freshcart.storefront.application.notification.listener;

import com.freshcart.storefront.application.notification.CustomerNotifier;
import com.freshcart.storefront.domain.order.event.OrderItemStatusChangedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * 주문 항목 상태 변경 알림 리스너
 * 상태 변경 트랜잭션이 커밋된 후에만 고객에게 알린다. 발송 실패는 상태 변경에 영향을 주지 않는다.
 */
@Slf4j
@Component
public class OrderItemStatusNotificationListener {

    private final CustomerNotifier customerNotifier;

    public OrderItemStatusNotificationListener(CustomerNotifier customerNotifier) {
        this.customerNotifier = customerNotifier;
    }

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleStatusChanged(OrderItemStatusChangedEvent event) {
        log.info("[OrderItemStatusNotificationListener] 상태 변경 알림 - orderItemId={}, {} → {}",
            event.getOrderItemId(), event.getPreviousStatus(), event.getNewStatus());

        try {
            customerNotifier.sendOrderItemStatusUpdate(event);
        } catch (RuntimeException e) {
            log.error("[OrderItemStatusNotificationListener] 고객 알림 발송 실패 - orderItemId={}",
                event.getOrderItemId(), e);
        }
    }
}
