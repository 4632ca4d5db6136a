package com.freshcart.storefront.infrastructure.persistence.order;

import com.freshcart.storefront.domain.order.OrderItem;
import com.freshcart.storefront.domain.order.OrderItemStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

/**
 * OrderItem JPA Repository
 * 판매자 주문 조회 조건은 OrderItemSpecifications로 조합한다.
 */
public interface OrderItemJpaRepository extends JpaRepository<OrderItem, Long>, JpaSpecificationExecutor<OrderItem> {

    /**
     * 주문 항목을 주문 헤더와 함께 조회
     */
    @Query("SELECT oi FROM OrderItem oi JOIN FETCH oi.order WHERE oi.orderItemId = :orderItemId")
    Optional<OrderItem> findByIdWithOrder(@Param("orderItemId") Long orderItemId);

    @Query("SELECT oi FROM OrderItem oi JOIN FETCH oi.order " +
           "WHERE oi.vendorId = :vendorId " +
           "ORDER BY oi.createdAt DESC, oi.orderItemId DESC")
    List<OrderItem> findRecentByVendorId(@Param("vendorId") Long vendorId, Pageable pageable);

    long countByVendorId(Long vendorId);

    long countByVendorIdAndStatus(Long vendorId, OrderItemStatus status);

    boolean existsByProductId(Long productId);
}
