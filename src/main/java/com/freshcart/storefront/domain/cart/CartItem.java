package com.freshcart.storefront.domain.cart;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * CartItem 도메인 엔티티
 * 쇼핑 카트의 라인 항목 (장바구니당 상품별 1행)
 */
@Entity
@Table(name = "cart_items", uniqueConstraints = {
    @UniqueConstraint(columnNames = {"cart_id", "product_id"})
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartItem {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "cart_item_id")
    private Long cartItemId;

    @Column(name = "cart_id", nullable = false)
    private Long cartId;

    @Column(name = "product_id", nullable = false)
    private Long productId;

    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static CartItem create(Long cartId, Long productId) {
        LocalDateTime now = LocalDateTime.now();
        return CartItem.builder()
                .cartId(cartId)
                .productId(productId)
                .quantity(0)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * 수량 1 증가
     *
     * @throws InvalidQuantityException 최대 수량(1000)을 넘는 경우
     */
    public void increase() {
        int next = quantity + 1;
        if (next > CartConstants.MAX_CART_QUANTITY) {
            throw new InvalidQuantityException(next);
        }
        this.quantity = next;
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 수량 1 감소
     *
     * @return 감소 후에도 항목이 남아 있으면 true, 0이 되어 삭제 대상이면 false
     */
    public boolean decrease() {
        this.quantity = quantity - 1;
        this.updatedAt = LocalDateTime.now();
        return quantity >= CartConstants.MIN_CART_QUANTITY;
    }

    public boolean belongsTo(Long cartId) {
        return this.cartId != null && this.cartId.equals(cartId);
    }
}
