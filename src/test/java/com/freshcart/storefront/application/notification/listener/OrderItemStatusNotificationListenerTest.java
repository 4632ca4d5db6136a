package com.freshcart.storefront.application.notification.listener;

import com.freshcart.storefront.application.notification.CustomerNotifier;
import com.freshcart.storefront.domain.order.OrderItemStatus;
import com.freshcart.storefront.domain.order.event.OrderItemStatusChangedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("OrderItemStatusNotificationListener 단위 테스트")
class OrderItemStatusNotificationListenerTest {

    private OrderItemStatusNotificationListener listener;

    @Mock
    private CustomerNotifier customerNotifier;

    private OrderItemStatusChangedEvent event;

    @BeforeEach
    void setup() {
        listener = new OrderItemStatusNotificationListener(customerNotifier);
        event = new OrderItemStatusChangedEvent(50L, 500L, 7L, "Fresh Milk", "Green Basket",
                OrderItemStatus.PREPARING, OrderItemStatus.OUT_FOR_DELIVERY, LocalDateTime.now());
    }

    @Test
    @DisplayName("상태 변경 이벤트 - 고객 알림 발송")
    void testHandleStatusChanged() {
        listener.handleStatusChanged(event);

        verify(customerNotifier).sendOrderItemStatusUpdate(event);
    }

    @Test
    @DisplayName("알림 발송 실패는 로그만 남기고 전파하지 않음")
    void testHandleStatusChanged_NotifierFailure() {
        doThrow(new IllegalStateException("mail server down"))
                .when(customerNotifier).sendOrderItemStatusUpdate(event);

        assertDoesNotThrow(() -> listener.handleStatusChanged(event));
        verify(customerNotifier).sendOrderItemStatusUpdate(event);
    }
}
