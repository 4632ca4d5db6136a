package com.freshcart.storefront.presentation.catalog.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 카테고리별 상품 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CategoryProductsResponse {
    @JsonProperty("category")
    private CategoryResponse category;

    @JsonProperty("products")
    private List<ProductSummaryResponse> products;

    @JsonProperty("categories")
    private List<CategoryResponse> categories;
}
