package com.freshcart.storefront.infrastructure.persistence.order;

import com.freshcart.storefront.domain.order.Order;
import com.freshcart.storefront.domain.order.OrderRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 Order Repository 구현
 */
@Repository
@Primary
public class MySQLOrderRepository implements OrderRepository {

    private final OrderJpaRepository orderJpaRepository;

    public MySQLOrderRepository(OrderJpaRepository orderJpaRepository) {
        this.orderJpaRepository = orderJpaRepository;
    }

    @Override
    public Order save(Order order) {
        return orderJpaRepository.save(order);
    }

    @Override
    public Optional<Order> findById(Long orderId) {
        return orderJpaRepository.findById(orderId);
    }

    @Override
    public List<Order> findByUserIdWithItems(Long userId) {
        return orderJpaRepository.findByUserIdWithItems(userId);
    }

    @Override
    public long count() {
        return orderJpaRepository.count();
    }
}
