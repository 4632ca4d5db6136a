package com.freshcart.storefront.domain.product;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Product Repository Interface (Domain Layer - Port)
 *
 * 스토어프론트 조회는 "활성 + 판매 가능 + 승인된 판매자" 조건을 항상 적용한다.
 */
public interface ProductRepository {

    Optional<Product> findById(Long productId);

    Optional<Product> findBySlug(String slug);

    boolean existsBySlug(String slug);

    List<Product> findAllById(Collection<Long> productIds);

    /**
     * 스토어프론트 최신 상품 조회 (최신순)
     *
     * @param limit 최대 개수
     */
    List<Product> findLatestStorefrontProducts(int limit);

    /**
     * 카테고리별 스토어프론트 상품 조회 (최신순)
     */
    List<Product> findStorefrontProductsByCategory(Long categoryId);

    /**
     * 판매자 상품 목록 (최신순)
     *
     * @param vendorId 판매자 ID
     * @param categoryId 카테고리 필터 (null이면 전체)
     * @param available 판매 가능 여부 필터 (null이면 전체)
     */
    List<Product> findByVendor(Long vendorId, Long categoryId, Boolean available);

    /**
     * 판매자의 특정 카테고리 상품 ID 목록 (매출 카테고리 필터용)
     */
    List<Long> findIdsByVendorAndCategory(Long vendorId, Long categoryId);

    /**
     * 재고 부족 상품 조회 (0 < 수량 ≤ 임계값, 수량 오름차순)
     */
    List<Product> findLowStockByVendor(Long vendorId);

    long countByVendorId(Long vendorId);

    long countAvailableByVendorId(Long vendorId);

    Product save(Product product);

    void delete(Product product);
}
