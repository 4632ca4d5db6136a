package com.freshcart.storefront.infrastructure.persistence.category;

import com.freshcart.storefront.domain.category.Category;
import com.freshcart.storefront.domain.category.CategoryRepository;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 Category Repository 구현
 */
@Repository
@Primary
public class MySQLCategoryRepository implements CategoryRepository {

    private final CategoryJpaRepository categoryJpaRepository;

    public MySQLCategoryRepository(CategoryJpaRepository categoryJpaRepository) {
        this.categoryJpaRepository = categoryJpaRepository;
    }

    @Override
    public Optional<Category> findById(Long categoryId) {
        return categoryJpaRepository.findById(categoryId);
    }

    @Override
    public Optional<Category> findBySlug(String slug) {
        return categoryJpaRepository.findBySlug(slug);
    }

    @Override
    public List<Category> findAllActive() {
        return categoryJpaRepository.findByActiveTrueOrderByNameAsc();
    }

    @Override
    public List<Category> findAllById(Collection<Long> categoryIds) {
        return categoryJpaRepository.findAllById(categoryIds);
    }

    @Override
    public boolean existsBySlug(String slug) {
        return categoryJpaRepository.existsBySlug(slug);
    }

    @Override
    public long count() {
        return categoryJpaRepository.count();
    }

    @Override
    public Category save(Category category) {
        return categoryJpaRepository.save(category);
    }
}
