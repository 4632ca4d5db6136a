package com.freshcart.storefront.application.notification;

import com.freshcart.storefront.domain.order.event.OrderItemStatusChangedEvent;
import com.freshcart.storefront.domain.vendor.Vendor;

/**
 * 고객/판매자 알림 발송 Port
 *
 * 실제 발송 채널(이메일 등)은 Infrastructure 계층 구현체가 담당한다.
 */
public interface CustomerNotifier {

    /**
     * 판매자 등록 접수 안내
     */
    void sendVendorRegistrationConfirmation(Vendor vendor);

    /**
     * 주문 항목 상태 변경 안내 (고객 대상)
     */
    void sendOrderItemStatusUpdate(OrderItemStatusChangedEvent event);
}
