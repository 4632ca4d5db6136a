package com.freshcart.storefront.application.fulfillment;

import com.freshcart.storefront.application.vendor.VendorAccessGuard;
import com.freshcart.storefront.common.exception.ForbiddenException;
import com.freshcart.storefront.common.exception.InvalidStatusTransitionException;
import com.freshcart.storefront.common.exception.ValidationException;
import com.freshcart.storefront.domain.order.OrderItem;
import com.freshcart.storefront.domain.order.OrderItemNotFoundException;
import com.freshcart.storefront.domain.order.OrderItemRepository;
import com.freshcart.storefront.domain.order.OrderItemSearchCondition;
import com.freshcart.storefront.domain.order.OrderItemStatus;
import com.freshcart.storefront.domain.order.event.OrderItemStatusChangedEvent;
import com.freshcart.storefront.domain.vendor.Vendor;
import com.freshcart.storefront.presentation.vendor.response.VendorOrderItemResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 판매자 주문 이행 서비스
 *
 * 판매자는 자신의 상품이 포함된 주문 항목만 조회/변경할 수 있다.
 * 상태 변경이 커밋되면 OrderItemStatusChangedEvent 리스너가 고객에게 알린다.
 */
@Service
public class FulfillmentService {

    private static final Logger log = LoggerFactory.getLogger(FulfillmentService.class);

    private final VendorAccessGuard vendorAccessGuard;
    private final OrderItemRepository orderItemRepository;
    private final ApplicationEventPublisher eventPublisher;

    public FulfillmentService(VendorAccessGuard vendorAccessGuard,
                              OrderItemRepository orderItemRepository,
                              ApplicationEventPublisher eventPublisher) {
        this.vendorAccessGuard = vendorAccessGuard;
        this.orderItemRepository = orderItemRepository;
        this.eventPublisher = eventPublisher;
    }

    /**
     * 주문 항목 상태 변경
     *
     * @throws OrderItemNotFoundException 주문 항목이 없는 경우
     * @throws ForbiddenException 다른 판매자의 주문 항목인 경우
     * @throws ValidationException 알 수 없는 상태 값
     * @throws InvalidStatusTransitionException 허용되지 않은 상태 전이
     */
    @Transactional
    public VendorOrderItemResponse updateStatus(Long userId, Long orderItemId, String newStatus) {
        Vendor vendor = vendorAccessGuard.requireApprovedVendor(userId);
        OrderItem orderItem = findOwnedOrderItem(vendor, orderItemId);

        OrderItemStatus target = OrderItemStatus.fromValue(newStatus)
                .orElseThrow(() -> new ValidationException("status", "알 수 없는 주문 상태입니다: " + newStatus));

        LocalDateTime changedAt = LocalDateTime.now();
        OrderItemStatus previous = orderItem.changeStatus(target, changedAt);
        OrderItem saved = orderItemRepository.save(orderItem);

        eventPublisher.publishEvent(new OrderItemStatusChangedEvent(
                saved.getOrderItemId(),
                saved.getOrderId(),
                saved.getOrder().getUserId(),
                saved.getProductName(),
                vendor.getShopName(),
                previous,
                target,
                changedAt));

        log.info("[FulfillmentService] 주문 항목 상태 변경 - orderItemId={}, {} → {}",
                orderItemId, previous, target);

        return VendorOrderItemResponse.withCustomer(saved);
    }

    /**
     * 본인 주문 항목 목록 (최신순)
     *
     * @param status 상태 필터 (null 또는 빈 값이면 전체)
     * @param dateFrom 주문 항목 생성일 시작 (포함)
     * @param dateTo 주문 항목 생성일 끝 (포함)
     */
    @Transactional(readOnly = true)
    public List<VendorOrderItemResponse> getOrderItems(Long userId, String status,
                                                       LocalDate dateFrom, LocalDate dateTo) {
        Vendor vendor = vendorAccessGuard.requireApprovedVendor(userId);

        OrderItemStatus statusFilter = null;
        if (status != null && !status.isBlank()) {
            statusFilter = OrderItemStatus.fromValue(status)
                    .orElseThrow(() -> new ValidationException("status", "알 수 없는 주문 상태입니다: " + status));
        }

        OrderItemSearchCondition condition = OrderItemSearchCondition.builder()
                .vendorId(vendor.getVendorId())
                .status(statusFilter)
                .createdFrom(dateFrom != null ? dateFrom.atStartOfDay() : null)
                .createdTo(dateTo != null ? dateTo.plusDays(1).atStartOfDay() : null)
                .build();

        return orderItemRepository.search(condition).stream()
                .map(VendorOrderItemResponse::from)
                .collect(Collectors.toList());
    }

    /**
     * 주문 항목 상세 (고객 연락처, 배송지 포함)
     */
    @Transactional(readOnly = true)
    public VendorOrderItemResponse getOrderItem(Long userId, Long orderItemId) {
        Vendor vendor = vendorAccessGuard.requireApprovedVendor(userId);
        return VendorOrderItemResponse.withCustomer(findOwnedOrderItem(vendor, orderItemId));
    }

    private OrderItem findOwnedOrderItem(Vendor vendor, Long orderItemId) {
        OrderItem orderItem = orderItemRepository.findByIdWithOrder(orderItemId)
                .orElseThrow(() -> new OrderItemNotFoundException(orderItemId));
        if (!orderItem.isOwnedBy(vendor.getVendorId())) {
            log.warn("[FulfillmentService] 타 판매자 주문 항목 접근 - vendorId={}, orderItemId={}",
                    vendor.getVendorId(), orderItemId);
            throw new ForbiddenException(String.format("orderItemId: %d", orderItemId));
        }
        return orderItem;
    }
}
