package com.freshcart.storefront.domain.order;

import java.util.List;
import java.util.Optional;

/**
 * Order Repository Interface (Domain Layer - Port)
 */
public interface OrderRepository {

    /**
     * 주문 저장 (항목은 cascade로 함께 저장)
     */
    Order save(Order order);

    Optional<Order> findById(Long orderId);

    /**
     * 사용자 주문 목록 (항목 포함, 최신순)
     */
    List<Order> findByUserIdWithItems(Long userId);

    long count();
}
