package com.freshcart.storefront.infrastructure.persistence.order;

import com.freshcart.storefront.domain.order.Order;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

/**
 * Order JPA Repository
 */
public interface OrderJpaRepository extends JpaRepository<Order, Long> {

    /**
     * 사용자 주문 목록을 주문 항목과 함께 조회 (N+1 방지 Fetch Join)
     *
     * @param userId 사용자 ID
     * @return 최신순 주문 목록
     */
    @Query("SELECT DISTINCT o FROM Order o LEFT JOIN FETCH o.orderItems " +
           "WHERE o.userId = :userId " +
           "ORDER BY o.createdAt DESC, o.orderId DESC")
    List<Order> findByUserIdWithItems(@Param("userId") Long userId);
}
