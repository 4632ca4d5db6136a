package com.freshcart.storefront.infrastructure.persistence.order;

import com.freshcart.storefront.domain.order.Order;
import com.freshcart.storefront.domain.order.OrderItem;
import com.freshcart.storefront.domain.order.OrderItemRepository;
import com.freshcart.storefront.domain.order.OrderItemSearchCondition;
import com.freshcart.storefront.domain.order.OrderItemStatus;
import com.freshcart.storefront.domain.order.OrderRepository;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * InMemoryOrderRepository - Order/OrderItem 저장소 구현체 (인메모리)
 * ConcurrentHashMap을 사용하여 스레드 안전성 제공
 */
public class InMemoryOrderRepository implements OrderRepository, OrderItemRepository {

    private static final Comparator<OrderItem> ITEM_NEWEST_FIRST =
            Comparator.comparing(OrderItem::getCreatedAt).thenComparing(OrderItem::getOrderItemId).reversed();

    private final ConcurrentHashMap<Long, Order> orders = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Long, OrderItem> orderItems = new ConcurrentHashMap<>();
    private final AtomicLong orderIdSequence = new AtomicLong(5000L);
    private final AtomicLong orderItemIdSequence = new AtomicLong(5000L);

    @Override
    public synchronized Order save(Order order) {
        if (order.getOrderId() != null) {
            orders.put(order.getOrderId(), order);
            return order;
        }

        // Builder로 ID가 할당된 사본 생성 (엔티티에 setter 없음)
        Order savedOrder = Order.builder()
                .orderId(orderIdSequence.incrementAndGet())
                .userId(order.getUserId())
                .customerName(order.getCustomerName())
                .customerPhone(order.getCustomerPhone())
                .deliveryAddress(order.getDeliveryAddress())
                .deliveryPincode(order.getDeliveryPincode())
                .paymentMethod(order.getPaymentMethod())
                .paid(order.isPaid())
                .totalAmount(BigDecimal.ZERO)
                .createdAt(order.getCreatedAt())
                .build();

        for (OrderItem item : order.getOrderItems()) {
            OrderItem savedItem = OrderItem.builder()
                    .orderItemId(orderItemIdSequence.incrementAndGet())
                    .productId(item.getProductId())
                    .vendorId(item.getVendorId())
                    .productName(item.getProductName())
                    .quantity(item.getQuantity())
                    .unitPrice(item.getUnitPrice())
                    .status(item.getStatus())
                    .statusChangedAt(item.getStatusChangedAt())
                    .createdAt(item.getCreatedAt())
                    .build();
            savedOrder.addOrderItem(savedItem);
            orderItems.put(savedItem.getOrderItemId(), savedItem);
        }

        orders.put(savedOrder.getOrderId(), savedOrder);
        return savedOrder;
    }

    @Override
    public Optional<Order> findById(Long orderId) {
        return Optional.ofNullable(orders.get(orderId));
    }

    @Override
    public List<Order> findByUserIdWithItems(Long userId) {
        return orders.values().stream()
                .filter(order -> order.getUserId().equals(userId))
                .sorted(Comparator.comparing(Order::getCreatedAt).thenComparing(Order::getOrderId).reversed())
                .collect(Collectors.toList());
    }

    @Override
    public long count() {
        return orders.size();
    }

    @Override
    public Optional<OrderItem> findByIdWithOrder(Long orderItemId) {
        return Optional.ofNullable(orderItems.get(orderItemId));
    }

    @Override
    public OrderItem save(OrderItem orderItem) {
        orderItems.put(orderItem.getOrderItemId(), orderItem);
        return orderItem;
    }

    @Override
    public List<OrderItem> search(OrderItemSearchCondition condition) {
        return orderItems.values().stream()
                .filter(matches(condition))
                .sorted(ITEM_NEWEST_FIRST)
                .collect(Collectors.toList());
    }

    @Override
    public List<OrderItem> findRecentByVendorId(Long vendorId, int limit) {
        return orderItems.values().stream()
                .filter(item -> item.isOwnedBy(vendorId))
                .sorted(ITEM_NEWEST_FIRST)
                .limit(limit)
                .collect(Collectors.toList());
    }

    @Override
    public long countByVendorId(Long vendorId) {
        return orderItems.values().stream().filter(item -> item.isOwnedBy(vendorId)).count();
    }

    @Override
    public long countByVendorIdAndStatus(Long vendorId, OrderItemStatus status) {
        return orderItems.values().stream()
                .filter(item -> item.isOwnedBy(vendorId) && item.getStatus() == status)
                .count();
    }

    @Override
    public boolean existsByProductId(Long productId) {
        return orderItems.values().stream().anyMatch(item -> item.getProductId().equals(productId));
    }

    private Predicate<OrderItem> matches(OrderItemSearchCondition c) {
        return item -> (c.getVendorId() == null || item.isOwnedBy(c.getVendorId()))
                && (c.getStatus() == null || item.getStatus() == c.getStatus())
                && (c.getCreatedFrom() == null || !item.getCreatedAt().isBefore(c.getCreatedFrom()))
                && (c.getCreatedTo() == null || item.getCreatedAt().isBefore(c.getCreatedTo()))
                && (c.getStatusChangedFrom() == null || !item.getStatusChangedAt().isBefore(c.getStatusChangedFrom()))
                && (c.getStatusChangedTo() == null || item.getStatusChangedAt().isBefore(c.getStatusChangedTo()))
                && (c.getProductId() == null || item.getProductId().equals(c.getProductId()))
                && (c.getProductIds() == null || c.getProductIds().contains(item.getProductId()));
    }
}
