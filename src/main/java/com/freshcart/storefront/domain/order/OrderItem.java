package com.freshcart.storefront.domain.order;

import com.freshcart.storefront.common.exception.InvalidStatusTransitionException;
import com.freshcart.storefront.domain.common.vo.Money;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * OrderItem 도메인 엔티티 (Rich Domain Model)
 *
 * 책임:
 * - 주문 내 각 상품 항목의 정보 관리
 * - 스냅샷: 주문 시점의 상품명, 판매자, 단가 보존
 * - 판매자별 이행 상태 전이 (OrderItemStatus)
 *
 * 핵심 비즈니스 규칙:
 * - 라인 합계 = 단가 × 수량
 * - 수량은 1 이상
 * - 주문 항목은 삭제되지 않으며 상품이 판매 중단되어도 이력으로 남음
 * - 상태 변경은 전이 테이블에 정의된 경우에만 허용
 */
@Entity
@Table(name = "order_items", indexes = {
    @Index(name = "idx_order_items_vendor", columnList = "vendor_id"),
    @Index(name = "idx_order_items_product", columnList = "product_id")
})
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderItem {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "order_item_id")
    private Long orderItemId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "order_id", nullable = false, updatable = false)
    private Order order;

    @Column(name = "product_id", nullable = false, updatable = false)
    private Long productId;

    @Column(name = "vendor_id", nullable = false, updatable = false)
    private Long vendorId;

    @Column(name = "product_name", nullable = false, length = 200, updatable = false)
    private String productName;

    @Column(name = "quantity", nullable = false, updatable = false)
    private Integer quantity;

    @Column(name = "unit_price", nullable = false, precision = 10, scale = 2, updatable = false)
    private BigDecimal unitPrice;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private OrderItemStatus status;

    @Column(name = "status_changed_at", nullable = false)
    private LocalDateTime statusChangedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    /**
     * OrderItem 생성 팩토리 메서드
     *
     * @param productId 상품 ID
     * @param vendorId 주문 시점의 판매자 ID (스냅샷)
     * @param productName 주문 시점의 상품명 (스냅샷)
     * @param quantity 수량 (1 이상)
     * @param unitPrice 주문 시점의 표시 가격 (스냅샷)
     */
    public static OrderItem createOrderItem(Long productId, Long vendorId, String productName,
                                            int quantity, Money unitPrice) {
        if (quantity < 1) {
            throw new IllegalArgumentException("수량은 1 이상이어야 합니다: " + quantity);
        }
        LocalDateTime now = LocalDateTime.now();
        return OrderItem.builder()
                .productId(productId)
                .vendorId(vendorId)
                .productName(productName)
                .quantity(quantity)
                .unitPrice(unitPrice.getAmount())
                .status(OrderItemStatus.PLACED)
                .statusChangedAt(now)
                .createdAt(now)
                .build();
    }

    void assignOrder(Order order) {
        this.order = order;
    }

    public Long getOrderId() {
        return order != null ? order.getOrderId() : null;
    }

    public Money getLineTotal() {
        return Money.of(unitPrice).multiply(quantity);
    }

    public boolean isOwnedBy(Long vendorId) {
        return this.vendorId != null && this.vendorId.equals(vendorId);
    }

    /**
     * 상태 변경
     *
     * @param target 변경할 상태
     * @param changedAt 변경 시각 (배송 완료 시 매출 집계 기준일)
     * @return 변경 전 상태
     * @throws InvalidStatusTransitionException 전이 테이블에 없는 변경인 경우
     */
    public OrderItemStatus changeStatus(OrderItemStatus target, LocalDateTime changedAt) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidStatusTransitionException(status.name(), target.name());
        }
        OrderItemStatus previous = this.status;
        this.status = target;
        this.statusChangedAt = changedAt;
        return previous;
    }
}
