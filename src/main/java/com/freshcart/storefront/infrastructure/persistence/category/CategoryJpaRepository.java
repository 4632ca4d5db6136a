package com.freshcart.storefront.infrastructure.persistence.category;

import com.freshcart.storefront.domain.category.Category;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

/**
 * Category JPA Repository
 */
public interface CategoryJpaRepository extends JpaRepository<Category, Long> {

    Optional<Category> findBySlug(String slug);

    List<Category> findByActiveTrueOrderByNameAsc();

    boolean existsBySlug(String slug);
}
