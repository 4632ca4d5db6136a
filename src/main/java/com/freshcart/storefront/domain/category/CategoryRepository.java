package com.freshcart.storefront.domain.category;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Category Repository Interface (Domain Layer - Port)
 */
public interface CategoryRepository {

    Optional<Category> findById(Long categoryId);

    Optional<Category> findBySlug(String slug);

    /**
     * 활성 카테고리를 이름순으로 조회
     */
    List<Category> findAllActive();

    List<Category> findAllById(Collection<Long> categoryIds);

    boolean existsBySlug(String slug);

    long count();

    Category save(Category category);
}
