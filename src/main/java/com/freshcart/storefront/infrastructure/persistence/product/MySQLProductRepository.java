package com.freshcart.storefront.infrastructure.persistence.product;

import com.freshcart.storefront.domain.product.Product;
import com.freshcart.storefront.domain.product.ProductRepository;
import com.freshcart.storefront.domain.vendor.VendorStatus;
import org.springframework.context.annotation.Primary;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 Product Repository 구현
 */
@Repository
@Primary
public class MySQLProductRepository implements ProductRepository {

    private final ProductJpaRepository productJpaRepository;

    public MySQLProductRepository(ProductJpaRepository productJpaRepository) {
        this.productJpaRepository = productJpaRepository;
    }

    @Override
    public Optional<Product> findById(Long productId) {
        return productJpaRepository.findById(productId);
    }

    @Override
    public Optional<Product> findBySlug(String slug) {
        return productJpaRepository.findBySlug(slug);
    }

    @Override
    public boolean existsBySlug(String slug) {
        return productJpaRepository.existsBySlug(slug);
    }

    @Override
    public List<Product> findAllById(Collection<Long> productIds) {
        return productJpaRepository.findAllById(productIds);
    }

    @Override
    public List<Product> findLatestStorefrontProducts(int limit) {
        return productJpaRepository.findStorefrontProducts(null, VendorStatus.APPROVED, PageRequest.of(0, limit));
    }

    @Override
    public List<Product> findStorefrontProductsByCategory(Long categoryId) {
        return productJpaRepository.findStorefrontProducts(categoryId, VendorStatus.APPROVED, Pageable.unpaged());
    }

    @Override
    public List<Product> findByVendor(Long vendorId, Long categoryId, Boolean available) {
        return productJpaRepository.findByVendor(vendorId, categoryId, available);
    }

    @Override
    public List<Long> findIdsByVendorAndCategory(Long vendorId, Long categoryId) {
        return productJpaRepository.findIdsByVendorIdAndCategoryId(vendorId, categoryId);
    }

    @Override
    public List<Product> findLowStockByVendor(Long vendorId) {
        return productJpaRepository.findLowStockByVendorId(vendorId);
    }

    @Override
    public long countByVendorId(Long vendorId) {
        return productJpaRepository.countByVendorId(vendorId);
    }

    @Override
    public long countAvailableByVendorId(Long vendorId) {
        return productJpaRepository.countByVendorIdAndAvailableTrue(vendorId);
    }

    @Override
    public Product save(Product product) {
        return productJpaRepository.save(product);
    }

    @Override
    public void delete(Product product) {
        productJpaRepository.delete(product);
    }
}
