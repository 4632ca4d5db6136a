package com.freshcart.storefront.presentation.catalog;

import com.freshcart.storefront.application.product.CatalogService;
import com.freshcart.storefront.presentation.catalog.response.CategoryProductsResponse;
import com.freshcart.storefront.presentation.catalog.response.HomeResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

/**
 * CatalogController - 스토어프론트 상품 조회
 */
@RestController
public class CatalogController {

    private final CatalogService catalogService;

    public CatalogController(CatalogService catalogService) {
        this.catalogService = catalogService;
    }

    /**
     * GET / - 홈 (최신 상품 + 카테고리)
     */
    @GetMapping("/")
    public ResponseEntity<HomeResponse> home() {
        return ResponseEntity.ok(catalogService.getHome());
    }

    /**
     * GET /category/{slug}/ - 카테고리별 상품
     */
    @GetMapping("/category/{slug}/")
    public ResponseEntity<CategoryProductsResponse> categoryProducts(@PathVariable("slug") String slug) {
        return ResponseEntity.ok(catalogService.getCategoryProducts(slug));
    }
}
