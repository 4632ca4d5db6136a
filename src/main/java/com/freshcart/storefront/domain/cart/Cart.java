package com.freshcart.storefront.domain.cart;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Cart 도메인 엔티티
 * 사용자별 쇼핑 카트 (1:1 관계)
 * 합계는 저장하지 않고 조회 시점의 상품 가격으로 다시 계산한다.
 */
@Entity
@Table(name = "carts", uniqueConstraints = {
    @UniqueConstraint(columnNames = "user_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Cart {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "cart_id")
    private Long cartId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static Cart create(Long userId) {
        LocalDateTime now = LocalDateTime.now();
        return Cart.builder()
                .userId(userId)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }
}
