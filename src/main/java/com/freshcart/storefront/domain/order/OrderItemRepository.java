package com.freshcart.storefront.domain.order;

import java.util.List;
import java.util.Optional;

/**
 * OrderItem Repository Interface (Domain Layer - Port)
 * 판매자 이행/매출 조회 전용
 */
public interface OrderItemRepository {

    /**
     * 주문 항목 조회 (주문 헤더 포함)
     */
    Optional<OrderItem> findByIdWithOrder(Long orderItemId);

    OrderItem save(OrderItem orderItem);

    /**
     * 조건 검색 (최신순)
     */
    List<OrderItem> search(OrderItemSearchCondition condition);

    /**
     * 판매자 최근 주문 항목
     */
    List<OrderItem> findRecentByVendorId(Long vendorId, int limit);

    long countByVendorId(Long vendorId);

    long countByVendorIdAndStatus(Long vendorId, OrderItemStatus status);

    /**
     * 상품을 참조하는 주문 항목 존재 여부 (상품 삭제 가능 판단)
     */
    boolean existsByProductId(Long productId);
}
