package com.freshcart.storefront.application.product;

import com.freshcart.storefront.application.product.ProductFormValidator.ValidatedProduct;
import com.freshcart.storefront.common.exception.ValidationException;
import com.freshcart.storefront.config.TestDataFactory;
import com.freshcart.storefront.domain.category.Category;
import com.freshcart.storefront.domain.category.CategoryRepository;
import com.freshcart.storefront.domain.product.ProductUnit;
import com.freshcart.storefront.presentation.vendor.request.ProductFormRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ProductFormValidator 단위 테스트")
class ProductFormValidatorTest {

    private ProductFormValidator validator;

    @Mock
    private CategoryRepository categoryRepository;

    @BeforeEach
    void setup() {
        validator = new ProductFormValidator(categoryRepository);
    }

    private ProductFormRequest.ProductFormRequestBuilder validRequest() {
        return ProductFormRequest.builder()
                .name(" Fresh Milk ")
                .categoryId(1L)
                .description("Toned milk, 1 litre")
                .price(new BigDecimal("50.00"))
                .discountPrice(new BigDecimal("45.50"))
                .quantity(20)
                .unit("L");
    }

    @Test
    @DisplayName("정상 입력 - 기본값 적용")
    void testValidate_Defaults() {
        // Given
        when(categoryRepository.findById(1L))
                .thenReturn(Optional.of(TestDataFactory.createCategory(1L, "Dairy", "dairy")));

        // When
        ValidatedProduct result = validator.validate(validRequest().imageUrl("  ").build());

        // Then
        assertEquals("Dairy", result.getCategory().getName());
        assertEquals("Fresh Milk", result.getDetails().getName());
        assertEquals(ProductUnit.L, result.getDetails().getUnit());
        assertEquals(10, result.getDetails().getLowStockThreshold());
        assertTrue(result.getDetails().isAvailable());
        assertNull(result.getDetails().getImageUrl());
    }

    @Test
    @DisplayName("할인가가 정가 이상이면 오류")
    void testValidate_DiscountNotLower() {
        when(categoryRepository.findById(1L))
                .thenReturn(Optional.of(TestDataFactory.createCategory(1L, "Dairy", "dairy")));

        ValidationException exception = assertThrows(ValidationException.class,
                () -> validator.validate(validRequest().discountPrice(new BigDecimal("50.00")).build()));

        assertEquals(1, exception.getFieldErrors().size());
        assertEquals("할인가는 정가보다 작아야 합니다", exception.getFieldErrors().get("discount_price"));
    }

    @Test
    @DisplayName("가격 형식 오류 - 음수, 소수점 셋째 자리")
    void testValidate_InvalidAmounts() {
        when(categoryRepository.findById(1L))
                .thenReturn(Optional.of(TestDataFactory.createCategory(1L, "Dairy", "dairy")));

        ValidationException exception = assertThrows(ValidationException.class,
                () -> validator.validate(validRequest()
                        .price(new BigDecimal("-1"))
                        .discountPrice(new BigDecimal("10.125"))
                        .build()));

        Map<String, String> errors = exception.getFieldErrors();
        assertTrue(errors.containsKey("price"));
        assertTrue(errors.containsKey("discount_price"));
    }

    @Test
    @DisplayName("필수 항목 누락, 알 수 없는 단위, 음수 재고")
    void testValidate_MultipleErrors() {
        ValidationException exception = assertThrows(ValidationException.class,
                () -> validator.validate(ProductFormRequest.builder()
                        .quantity(-1)
                        .lowStockThreshold(-5)
                        .unit("dozen")
                        .build()));

        Map<String, String> errors = exception.getFieldErrors();
        assertTrue(errors.containsKey("name"));
        assertTrue(errors.containsKey("description"));
        assertTrue(errors.containsKey("category_id"));
        assertTrue(errors.containsKey("price"));
        assertTrue(errors.containsKey("quantity"));
        assertTrue(errors.containsKey("low_stock_threshold"));
        assertTrue(errors.containsKey("unit"));
    }

    @Test
    @DisplayName("비활성 카테고리 선택 불가")
    void testValidate_InactiveCategory() {
        when(categoryRepository.findById(2L)).thenReturn(Optional.of(
                Category.builder()
                        .categoryId(2L)
                        .name("Seasonal")
                        .slug("seasonal")
                        .active(false)
                        .build()));

        ValidationException exception = assertThrows(ValidationException.class,
                () -> validator.validate(validRequest().categoryId(2L).build()));

        assertTrue(exception.getFieldErrors().containsKey("category_id"));
    }
}
