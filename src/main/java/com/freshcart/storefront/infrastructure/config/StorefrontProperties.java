package com.freshcart.storefront.infrastructure.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * storefront.* 애플리케이션 설정
 *
 * application.yml 예:
 * <pre>
 * storefront:
 *   catalog:
 *     home-product-limit: 20
 *     seed-categories: true
 *   vendor:
 *     dashboard-recent-items: 10
 *     dashboard-low-stock-items: 5
 *     earnings-top-products: 10
 * </pre>
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "storefront")
public class StorefrontProperties {

    @Valid
    private Catalog catalog = new Catalog();
    @Valid
    private Vendor vendor = new Vendor();

    @Getter
    @Setter
    public static class Catalog {
        /** 홈 화면 최신 상품 개수 */
        @Min(1)
        private int homeProductLimit = 20;
        /** 카테고리 테이블이 비어 있으면 기본 카테고리 등록 */
        private boolean seedCategories = false;
    }

    @Getter
    @Setter
    public static class Vendor {
        @Min(1)
        private int dashboardRecentItems = 10;
        @Min(1)
        private int dashboardLowStockItems = 5;
        @Min(1)
        private int earningsTopProducts = 10;
    }
}
