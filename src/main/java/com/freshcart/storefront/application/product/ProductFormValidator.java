package com.freshcart.storefront.application.product;

import com.freshcart.storefront.common.exception.ValidationException;
import com.freshcart.storefront.domain.category.Category;
import com.freshcart.storefront.domain.category.CategoryRepository;
import com.freshcart.storefront.domain.product.ProductDetails;
import com.freshcart.storefront.domain.product.ProductUnit;
import com.freshcart.storefront.presentation.vendor.request.ProductFormRequest;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * ProductFormValidator - 상품 등록/수정 입력값 검증
 *
 * 검증 항목:
 * - name, description 필수 / category는 존재하는 활성 카테고리
 * - price ≥ 0, 소수점 둘째 자리까지
 * - discount_price < price
 * - quantity ≥ 0, low_stock_threshold ≥ 0 (기본 10)
 * - unit ∈ {kg, g, l, ml, piece, pack}
 */
@Component
public class ProductFormValidator {

    static final int DEFAULT_LOW_STOCK_THRESHOLD = 10;
    private static final int PRICE_SCALE = 2;
    private static final BigDecimal MAX_PRICE = new BigDecimal("99999999.99");

    private final CategoryRepository categoryRepository;

    public ProductFormValidator(CategoryRepository categoryRepository) {
        this.categoryRepository = categoryRepository;
    }

    /**
     * @throws ValidationException 하나 이상의 필드가 유효하지 않은 경우
     */
    public ValidatedProduct validate(ProductFormRequest request) {
        Map<String, String> errors = new LinkedHashMap<>();

        String name = trim(request.getName());
        if (name.isEmpty()) {
            errors.put("name", "상품명을 입력해주세요");
        }

        String description = trim(request.getDescription());
        if (description.isEmpty()) {
            errors.put("description", "상품 설명을 입력해주세요");
        }

        Category category = null;
        if (request.getCategoryId() == null) {
            errors.put("category_id", "카테고리를 선택해주세요");
        } else {
            category = categoryRepository.findById(request.getCategoryId())
                    .filter(Category::isActive)
                    .orElse(null);
            if (category == null) {
                errors.put("category_id", "존재하지 않는 카테고리입니다");
            }
        }

        BigDecimal price = request.getPrice();
        if (price == null) {
            errors.put("price", "가격을 입력해주세요");
        } else if (!isValidAmount(price)) {
            errors.put("price", "가격은 0 이상, 소수점 둘째 자리까지 입력해주세요");
        }

        BigDecimal discountPrice = request.getDiscountPrice();
        if (discountPrice != null) {
            if (!isValidAmount(discountPrice)) {
                errors.put("discount_price", "할인가는 0 이상, 소수점 둘째 자리까지 입력해주세요");
            } else if (price != null && discountPrice.compareTo(price) >= 0) {
                errors.put("discount_price", "할인가는 정가보다 작아야 합니다");
            }
        }

        Integer quantity = request.getQuantity();
        if (quantity == null) {
            errors.put("quantity", "재고 수량을 입력해주세요");
        } else if (quantity < 0) {
            errors.put("quantity", "재고 수량은 0 이상이어야 합니다");
        }

        Integer lowStockThreshold = request.getLowStockThreshold() != null
                ? request.getLowStockThreshold()
                : DEFAULT_LOW_STOCK_THRESHOLD;
        if (lowStockThreshold < 0) {
            errors.put("low_stock_threshold", "재고 부족 기준은 0 이상이어야 합니다");
        }

        ProductUnit unit = ProductUnit.fromValue(request.getUnit()).orElse(null);
        if (unit == null) {
            errors.put("unit", "단위는 kg, g, l, ml, piece, pack 중 하나여야 합니다");
        }

        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }

        String imageUrl = trim(request.getImageUrl());
        ProductDetails details = ProductDetails.builder()
                .name(name)
                .description(description)
                .price(price)
                .discountPrice(discountPrice)
                .quantity(quantity)
                .unit(unit)
                .lowStockThreshold(lowStockThreshold)
                .imageUrl(imageUrl.isEmpty() ? null : imageUrl)
                .available(request.getAvailable() == null || request.getAvailable())
                .build();
        return new ValidatedProduct(category, details);
    }

    private static boolean isValidAmount(BigDecimal amount) {
        return amount.signum() >= 0
                && amount.stripTrailingZeros().scale() <= PRICE_SCALE
                && amount.compareTo(MAX_PRICE) <= 0;
    }

    private static String trim(String value) {
        return value == null ? "" : value.trim();
    }

    @Getter
    @AllArgsConstructor
    public static class ValidatedProduct {
        private final Category category;
        private final ProductDetails details;
    }
}
