package com.freshcart.storefront.presentation.catalog.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 홈 화면 응답 DTO (최신 상품 + 활성 카테고리)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HomeResponse {
    @JsonProperty("products")
    private List<ProductSummaryResponse> products;

    @JsonProperty("categories")
    private List<CategoryResponse> categories;
}
