package com.freshcart.storefront.domain.product;

import com.freshcart.storefront.domain.common.vo.Money;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Product 도메인 엔티티 (Rich Domain Model)
 *
 * 책임:
 * - 판매자가 등록한 상품 정보 관리
 * - 표시 가격(할인가 우선) 계산
 * - 재고 부족 여부 판단
 * - 판매 가능 여부 토글 및 판매 중단(retire) 처리
 *
 * 핵심 비즈니스 규칙:
 * - 슬러그는 생성 후 변경되지 않음
 * - 할인가는 정가보다 작아야 함 (검증은 ProductFormValidator)
 * - 재고 수량은 0 이상
 */
@Entity
@Table(name = "products",
    uniqueConstraints = {
        @UniqueConstraint(columnNames = "slug")
    },
    indexes = {
        @Index(name = "idx_products_vendor", columnList = "vendor_id"),
        @Index(name = "idx_products_category", columnList = "category_id")
    })
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Product {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "product_id")
    private Long productId;

    @Column(name = "vendor_id", nullable = false)
    private Long vendorId;

    @Column(name = "category_id", nullable = false)
    private Long categoryId;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "slug", nullable = false, length = 220, updatable = false)
    private String slug;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "price", nullable = false, precision = 10, scale = 2)
    private BigDecimal price;

    @Column(name = "discount_price", precision = 10, scale = 2)
    private BigDecimal discountPrice;

    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    @Enumerated(EnumType.STRING)
    @Column(name = "unit", nullable = false, length = 10)
    private ProductUnit unit;

    @Column(name = "low_stock_threshold", nullable = false)
    private Integer lowStockThreshold;

    @Column(name = "image_url", length = 500)
    private String imageUrl;

    @Column(name = "active", nullable = false)
    private boolean active;

    @Column(name = "available", nullable = false)
    private boolean available;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * 상품 등록 팩토리 메서드
     * 신규 상품은 활성 상태로 생성된다.
     */
    public static Product create(Long vendorId, Long categoryId, String slug, ProductDetails details) {
        LocalDateTime now = LocalDateTime.now();
        return Product.builder()
                .vendorId(vendorId)
                .categoryId(categoryId)
                .slug(slug)
                .name(details.getName())
                .description(details.getDescription())
                .price(details.getPrice())
                .discountPrice(details.getDiscountPrice())
                .quantity(details.getQuantity())
                .unit(details.getUnit())
                .lowStockThreshold(details.getLowStockThreshold())
                .imageUrl(details.getImageUrl())
                .active(true)
                .available(details.isAvailable())
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * 상품 정보 수정 (슬러그는 유지)
     */
    public void update(Long categoryId, ProductDetails details) {
        this.categoryId = categoryId;
        this.name = details.getName();
        this.description = details.getDescription();
        this.price = details.getPrice();
        this.discountPrice = details.getDiscountPrice();
        this.quantity = details.getQuantity();
        this.unit = details.getUnit();
        this.lowStockThreshold = details.getLowStockThreshold();
        if (details.getImageUrl() != null) {
            this.imageUrl = details.getImageUrl();
        }
        this.available = details.isAvailable();
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 표시 가격: 할인가가 있으면 할인가, 없으면 정가
     */
    public Money getDisplayPrice() {
        return Money.of(discountPrice != null ? discountPrice : price);
    }

    public boolean hasDiscount() {
        return discountPrice != null && discountPrice.compareTo(price) < 0;
    }

    public boolean isInStock() {
        return quantity != null && quantity > 0;
    }

    /**
     * 재고 부족: 0 < 수량 ≤ 임계값 (품절은 재고 부족으로 보지 않음)
     */
    public boolean isLowStock() {
        return quantity != null && quantity > 0 && quantity <= lowStockThreshold;
    }

    /**
     * 스토어프론트 노출/장바구니 담기 가능 여부 (판매자 승인 여부는 별도 확인)
     */
    public boolean isPurchasable() {
        return active && available;
    }

    public boolean isOwnedBy(Long vendorId) {
        return this.vendorId != null && this.vendorId.equals(vendorId);
    }

    public void toggleAvailability() {
        this.available = !this.available;
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 주문 이력이 있는 상품의 판매 중단 처리
     * 행을 지우지 않고 스토어프론트와 장바구니에서만 제외한다.
     */
    public void retire() {
        this.active = false;
        this.available = false;
        this.updatedAt = LocalDateTime.now();
    }
}
