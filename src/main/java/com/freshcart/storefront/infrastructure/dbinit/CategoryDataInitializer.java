package com.freshcart.storefront.infrastructure.dbinit;

import com.freshcart.storefront.common.util.SlugUtils;
import com.freshcart.storefront.domain.category.Category;
import com.freshcart.storefront.domain.category.CategoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * 기본 식료품 카테고리 등록
 *
 * storefront.catalog.seed-categories=true 이고 카테고리 테이블이 비어 있을 때만 실행된다.
 */
@Component
@ConditionalOnProperty(prefix = "storefront.catalog", name = "seed-categories", havingValue = "true")
public class CategoryDataInitializer implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(CategoryDataInitializer.class);

    static final List<String> DEFAULT_CATEGORIES = List.of(
            "Dairy, Bread & Eggs",
            "Fruits & Vegetables",
            "Cold Drinks & Juices",
            "Snacks & Munchies",
            "Breakfast & Instant Food",
            "Sweet Tooth",
            "Bakery & Biscuits",
            "Tea, Coffee & Milk Drinks",
            "Atta, Rice & Dal",
            "Masala, Oil & More",
            "Sauces & Spreads",
            "Chicken, Meat & Fish",
            "Organic & Healthy Living",
            "Baby Care",
            "Pharma & Wellness",
            "Cleaning Essentials",
            "Home & Office",
            "Personal Care",
            "Pet Care"
    );

    private final CategoryRepository categoryRepository;

    public CategoryDataInitializer(CategoryRepository categoryRepository) {
        this.categoryRepository = categoryRepository;
    }

    @Override
    @Transactional
    public void run(String... args) {
        long existing = categoryRepository.count();
        if (existing > 0) {
            log.info("[CategoryDataInitializer] 카테고리 {}개 존재, 기본 카테고리 등록 생략", existing);
            return;
        }

        int created = 0;
        for (String name : DEFAULT_CATEGORIES) {
            String slug = SlugUtils.generateSlug(name);
            if (categoryRepository.existsBySlug(slug)) {
                continue;
            }
            categoryRepository.save(Category.create(name, slug, name + " products"));
            created++;
        }
        log.info("[CategoryDataInitializer] 기본 카테고리 {}개 등록", created);
    }
}
