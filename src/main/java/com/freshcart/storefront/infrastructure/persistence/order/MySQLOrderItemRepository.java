package com.freshcart.storefront.infrastructure.persistence.order;

import com.freshcart.storefront.domain.order.OrderItem;
import com.freshcart.storefront.domain.order.OrderItemRepository;
import com.freshcart.storefront.domain.order.OrderItemSearchCondition;
import com.freshcart.storefront.domain.order.OrderItemStatus;
import org.springframework.context.annotation.Primary;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 OrderItem Repository 구현
 */
@Repository
@Primary
public class MySQLOrderItemRepository implements OrderItemRepository {

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("orderItemId"));

    private final OrderItemJpaRepository orderItemJpaRepository;

    public MySQLOrderItemRepository(OrderItemJpaRepository orderItemJpaRepository) {
        this.orderItemJpaRepository = orderItemJpaRepository;
    }

    @Override
    public Optional<OrderItem> findByIdWithOrder(Long orderItemId) {
        return orderItemJpaRepository.findByIdWithOrder(orderItemId);
    }

    @Override
    public OrderItem save(OrderItem orderItem) {
        return orderItemJpaRepository.save(orderItem);
    }

    @Override
    public List<OrderItem> search(OrderItemSearchCondition condition) {
        return orderItemJpaRepository.findAll(OrderItemSpecifications.matching(condition), NEWEST_FIRST);
    }

    @Override
    public List<OrderItem> findRecentByVendorId(Long vendorId, int limit) {
        return orderItemJpaRepository.findRecentByVendorId(vendorId, PageRequest.of(0, limit));
    }

    @Override
    public long countByVendorId(Long vendorId) {
        return orderItemJpaRepository.countByVendorId(vendorId);
    }

    @Override
    public long countByVendorIdAndStatus(Long vendorId, OrderItemStatus status) {
        return orderItemJpaRepository.countByVendorIdAndStatus(vendorId, status);
    }

    @Override
    public boolean existsByProductId(Long productId) {
        return orderItemJpaRepository.existsByProductId(productId);
    }
}
