package com.freshcart.storefront.infrastructure.persistence.product;

import com.freshcart.storefront.domain.product.Product;
import com.freshcart.storefront.domain.vendor.VendorStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

/**
 * Product JPA Repository
 */
public interface ProductJpaRepository extends JpaRepository<Product, Long> {

    Optional<Product> findBySlug(String slug);

    boolean existsBySlug(String slug);

    /**
     * 스토어프론트 노출 상품 조회
     * 활성 + 판매 가능 + 승인된 판매자 상품, 최신순
     *
     * @param categoryId 카테고리 필터 (null이면 전체)
     * @param vendorStatus 판매자 상태 (APPROVED)
     */
    @Query("SELECT p FROM Product p " +
           "WHERE p.active = true AND p.available = true " +
           "AND (:categoryId IS NULL OR p.categoryId = :categoryId) " +
           "AND p.vendorId IN (SELECT v.vendorId FROM Vendor v WHERE v.status = :vendorStatus) " +
           "ORDER BY p.createdAt DESC, p.productId DESC")
    List<Product> findStorefrontProducts(@Param("categoryId") Long categoryId,
                                         @Param("vendorStatus") VendorStatus vendorStatus,
                                         Pageable pageable);

    /**
     * 판매자 상품 목록 (카테고리, 판매 가능 여부 필터)
     */
    @Query("SELECT p FROM Product p " +
           "WHERE p.vendorId = :vendorId " +
           "AND (:categoryId IS NULL OR p.categoryId = :categoryId) " +
           "AND (:available IS NULL OR p.available = :available) " +
           "ORDER BY p.createdAt DESC, p.productId DESC")
    List<Product> findByVendor(@Param("vendorId") Long vendorId,
                               @Param("categoryId") Long categoryId,
                               @Param("available") Boolean available);

    @Query("SELECT p.productId FROM Product p WHERE p.vendorId = :vendorId AND p.categoryId = :categoryId")
    List<Long> findIdsByVendorIdAndCategoryId(@Param("vendorId") Long vendorId,
                                              @Param("categoryId") Long categoryId);

    /**
     * 재고 부족 상품 (0 < 수량 ≤ 임계값), 수량 오름차순
     */
    @Query("SELECT p FROM Product p " +
           "WHERE p.vendorId = :vendorId AND p.quantity > 0 AND p.quantity <= p.lowStockThreshold " +
           "ORDER BY p.quantity ASC, p.productId ASC")
    List<Product> findLowStockByVendorId(@Param("vendorId") Long vendorId);

    long countByVendorId(Long vendorId);

    long countByVendorIdAndAvailableTrue(Long vendorId);
}
