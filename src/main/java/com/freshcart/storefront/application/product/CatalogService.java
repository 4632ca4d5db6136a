package com.freshcart.storefront.application.product;

import com.freshcart.storefront.domain.category.Category;
import com.freshcart.storefront.domain.category.CategoryNotFoundException;
import com.freshcart.storefront.domain.category.CategoryRepository;
import com.freshcart.storefront.domain.product.Product;
import com.freshcart.storefront.domain.product.ProductRepository;
import com.freshcart.storefront.domain.vendor.Vendor;
import com.freshcart.storefront.domain.vendor.VendorRepository;
import com.freshcart.storefront.infrastructure.config.StorefrontProperties;
import com.freshcart.storefront.presentation.catalog.response.CategoryProductsResponse;
import com.freshcart.storefront.presentation.catalog.response.CategoryResponse;
import com.freshcart.storefront.presentation.catalog.response.HomeResponse;
import com.freshcart.storefront.presentation.catalog.response.ProductSummaryResponse;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 스토어프론트 카탈로그 조회 서비스
 *
 * 노출 조건: 활성 + 판매 가능 + 승인된 판매자의 상품 (조건은 ProductRepository 쿼리에서 적용)
 */
@Service
public class CatalogService {

    private final ProductRepository productRepository;
    private final CategoryRepository categoryRepository;
    private final VendorRepository vendorRepository;
    private final StorefrontProperties properties;

    public CatalogService(ProductRepository productRepository,
                          CategoryRepository categoryRepository,
                          VendorRepository vendorRepository,
                          StorefrontProperties properties) {
        this.productRepository = productRepository;
        this.categoryRepository = categoryRepository;
        this.vendorRepository = vendorRepository;
        this.properties = properties;
    }

    /**
     * 홈 화면: 최신 상품 + 활성 카테고리(이름순)
     */
    @Transactional(readOnly = true)
    public HomeResponse getHome() {
        List<Product> products = productRepository.findLatestStorefrontProducts(
                properties.getCatalog().getHomeProductLimit());

        return HomeResponse.builder()
                .products(toSummaries(products))
                .categories(activeCategories())
                .build();
    }

    /**
     * 카테고리별 상품
     *
     * @throws CategoryNotFoundException 슬러그가 없거나 비활성 카테고리인 경우
     */
    @Transactional(readOnly = true)
    public CategoryProductsResponse getCategoryProducts(String slug) {
        Category category = categoryRepository.findBySlug(slug)
                .filter(Category::isActive)
                .orElseThrow(() -> new CategoryNotFoundException(slug));

        List<Product> products = productRepository.findStorefrontProductsByCategory(category.getCategoryId());

        return CategoryProductsResponse.builder()
                .category(CategoryResponse.from(category))
                .products(toSummaries(products))
                .categories(activeCategories())
                .build();
    }

    private List<CategoryResponse> activeCategories() {
        return categoryRepository.findAllActive().stream()
                .map(CategoryResponse::from)
                .collect(Collectors.toList());
    }

    private List<ProductSummaryResponse> toSummaries(List<Product> products) {
        List<Long> vendorIds = products.stream()
                .map(Product::getVendorId)
                .distinct()
                .collect(Collectors.toList());
        Map<Long, String> shopNames = vendorRepository.findAllById(vendorIds).stream()
                .collect(Collectors.toMap(Vendor::getVendorId, Vendor::getShopName));

        return products.stream()
                .map(product -> ProductSummaryResponse.from(product, shopNames.get(product.getVendorId())))
                .collect(Collectors.toList());
    }
}
