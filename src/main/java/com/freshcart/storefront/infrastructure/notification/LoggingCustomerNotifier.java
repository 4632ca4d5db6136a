package com.freshcart.storefront.infrastructure.notification;

import com.freshcart.storefront.application.notification.CustomerNotifier;
import com.freshcart.storefront.domain.order.event.OrderItemStatusChangedEvent;
import com.freshcart.storefront.domain.user.User;
import com.freshcart.storefront.domain.user.UserRepository;
import com.freshcart.storefront.domain.vendor.Vendor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 로그 기반 알림 어댑터
 * 메일 발송 채널이 연결되기 전까지 발송 내용을 로그로 남긴다.
 */
@Slf4j
@Component
public class LoggingCustomerNotifier implements CustomerNotifier {

    private final UserRepository userRepository;

    public LoggingCustomerNotifier(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    @Override
    public void sendVendorRegistrationConfirmation(Vendor vendor) {
        log.info("[LoggingCustomerNotifier] 판매자 등록 접수 메일 - to={}, shopName={}, status={}",
            vendor.getEmail(), vendor.getShopName(), vendor.getStatus());
    }

    @Override
    public void sendOrderItemStatusUpdate(OrderItemStatusChangedEvent event) {
        String recipient = userRepository.findById(event.getCustomerUserId())
            .map(User::getEmail)
            .orElse("unknown");
        log.info("[LoggingCustomerNotifier] 주문 상태 안내 메일 - to={}, orderId={}, product={}, shop={}, status={}",
            recipient, event.getOrderId(), event.getProductName(), event.getShopName(),
            event.getNewStatus().getDisplayName());
    }
}
