package com.freshcart.storefront.domain.order;

import com.freshcart.storefront.domain.common.vo.Money;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Order 도메인 엔티티 (Rich Domain Model)
 *
 * 책임:
 * - 고객 주문 헤더 (배송지, 연락처, 결제 수단) 관리
 * - 주문 항목 집합 및 총액 계산
 *
 * 핵심 비즈니스 규칙:
 * - 주문 헤더는 생성 후 변경되지 않음
 * - 총액 = Σ(항목 단가 × 수량), 주문 시점 가격 기준
 * - 결제 연동이 없으므로 paid는 항상 false로 생성
 * - 항목별 상태는 각 판매자가 OrderItem 단위로 관리
 */
@Entity
@Table(name = "orders", indexes = {
    @Index(name = "idx_orders_user", columnList = "user_id")
})
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Order {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "order_id")
    private Long orderId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Column(name = "customer_name", nullable = false, length = 100, updatable = false)
    private String customerName;

    @Column(name = "customer_phone", nullable = false, length = 15, updatable = false)
    private String customerPhone;

    @Column(name = "delivery_address", nullable = false, columnDefinition = "TEXT", updatable = false)
    private String deliveryAddress;

    @Column(name = "delivery_pincode", length = 6, updatable = false)
    private String deliveryPincode;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_method", nullable = false, length = 20, updatable = false)
    private PaymentMethod paymentMethod;

    @Column(name = "paid", nullable = false)
    private boolean paid;

    @Column(name = "total_amount", nullable = false, precision = 12, scale = 2, updatable = false)
    private BigDecimal totalAmount;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @OneToMany(mappedBy = "order", cascade = CascadeType.PERSIST, fetch = FetchType.LAZY)
    @OrderBy("orderItemId ASC")
    @Builder.Default
    private List<OrderItem> orderItems = new ArrayList<>();

    /**
     * 주문 생성 팩토리 메서드
     *
     * @param userId 주문자 ID
     * @param contact 배송/연락처 정보 (검증 완료)
     * @param paymentMethod 결제 수단
     * @return 총액 0, 항목 없는 주문 (addOrderItem으로 항목 추가)
     */
    public static Order createOrder(Long userId, DeliveryContact contact, PaymentMethod paymentMethod) {
        return Order.builder()
                .userId(userId)
                .customerName(contact.getName())
                .customerPhone(contact.getPhone())
                .deliveryAddress(contact.getAddress())
                .deliveryPincode(contact.getPincode())
                .paymentMethod(paymentMethod)
                .paid(false)
                .totalAmount(BigDecimal.ZERO)
                .createdAt(LocalDateTime.now())
                .build();
    }

    /**
     * 주문 항목 추가 (총액 누적)
     */
    public void addOrderItem(OrderItem orderItem) {
        orderItem.assignOrder(this);
        this.orderItems.add(orderItem);
        this.totalAmount = Money.of(totalAmount).add(orderItem.getLineTotal()).getAmount();
    }

    public int getOrderItemCount() {
        return orderItems.size();
    }

    public Money getTotal() {
        return Money.of(totalAmount);
    }
}
