package com.freshcart.storefront.application.product;

import com.freshcart.storefront.config.TestDataFactory;
import com.freshcart.storefront.domain.category.Category;
import com.freshcart.storefront.domain.category.CategoryNotFoundException;
import com.freshcart.storefront.domain.category.CategoryRepository;
import com.freshcart.storefront.domain.product.Product;
import com.freshcart.storefront.domain.product.ProductRepository;
import com.freshcart.storefront.domain.vendor.VendorRepository;
import com.freshcart.storefront.infrastructure.config.StorefrontProperties;
import com.freshcart.storefront.presentation.catalog.response.CategoryProductsResponse;
import com.freshcart.storefront.presentation.catalog.response.HomeResponse;
import com.freshcart.storefront.presentation.catalog.response.ProductSummaryResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("CatalogService 단위 테스트")
class CatalogServiceTest {

    private CatalogService catalogService;

    @Mock
    private ProductRepository productRepository;

    @Mock
    private CategoryRepository categoryRepository;

    @Mock
    private VendorRepository vendorRepository;

    private StorefrontProperties properties;

    @BeforeEach
    void setup() {
        properties = new StorefrontProperties();
        properties.getCatalog().setHomeProductLimit(8);
        catalogService = new CatalogService(productRepository, categoryRepository, vendorRepository, properties);
    }

    // ========== 홈 화면 ==========

    @Test
    @DisplayName("홈 화면 - 설정된 개수만큼 최신 상품 조회, 상점명 포함")
    void testGetHome() {
        // Given
        Product milk = TestDataFactory.createProduct(1L, 10L, 100L, "Fresh Milk", "50.00", "45.00", 20);
        Product bread = TestDataFactory.createProduct(2L, 11L, 101L, "Brown Bread", "40.00", null, 5);
        when(productRepository.findLatestStorefrontProducts(8)).thenReturn(List.of(milk, bread));
        when(vendorRepository.findAllById(anyCollection())).thenReturn(List.of(
                TestDataFactory.createApprovedVendor(10L, 1L),
                TestDataFactory.createApprovedVendor(11L, 2L)));
        when(categoryRepository.findAllActive()).thenReturn(List.of(
                TestDataFactory.createCategory(100L, "Dairy", "dairy")));

        // When
        HomeResponse result = catalogService.getHome();

        // Then
        assertEquals(2, result.getProducts().size());
        ProductSummaryResponse first = result.getProducts().get(0);
        assertEquals("Fresh Milk", first.getName());
        assertEquals("Green Basket 10", first.getShopName());
        assertEquals(0, new BigDecimal("45.00").compareTo(first.getDisplayPrice()));
        assertTrue(first.isHasDiscount());
        assertEquals("Green Basket 11", result.getProducts().get(1).getShopName());
        assertEquals(1, result.getCategories().size());
        verify(productRepository).findLatestStorefrontProducts(8);
    }

    @Test
    @DisplayName("홈 화면 - 상품 없음")
    void testGetHome_Empty() {
        when(productRepository.findLatestStorefrontProducts(8)).thenReturn(List.of());
        when(vendorRepository.findAllById(anyCollection())).thenReturn(List.of());
        when(categoryRepository.findAllActive()).thenReturn(List.of());

        HomeResponse result = catalogService.getHome();

        assertTrue(result.getProducts().isEmpty());
        assertTrue(result.getCategories().isEmpty());
    }

    // ========== 카테고리별 상품 ==========

    @Test
    @DisplayName("카테고리 상품 - 성공")
    void testGetCategoryProducts() {
        // Given
        Category dairy = TestDataFactory.createCategory(100L, "Dairy", "dairy");
        Product milk = TestDataFactory.createProduct(1L, 10L, 100L, "Fresh Milk", "50.00", null, 20);
        when(categoryRepository.findBySlug("dairy")).thenReturn(Optional.of(dairy));
        when(productRepository.findStorefrontProductsByCategory(100L)).thenReturn(List.of(milk));
        when(vendorRepository.findAllById(anyCollection()))
                .thenReturn(List.of(TestDataFactory.createApprovedVendor(10L, 1L)));
        when(categoryRepository.findAllActive()).thenReturn(List.of(dairy));

        // When
        CategoryProductsResponse result = catalogService.getCategoryProducts("dairy");

        // Then
        assertEquals("dairy", result.getCategory().getSlug());
        assertEquals(1, result.getProducts().size());
        assertEquals(100L, result.getProducts().get(0).getCategoryId());
    }

    @Test
    @DisplayName("카테고리 상품 - 존재하지 않는 슬러그")
    void testGetCategoryProducts_NotFound() {
        when(categoryRepository.findBySlug("unknown")).thenReturn(Optional.empty());

        assertThrows(CategoryNotFoundException.class, () -> catalogService.getCategoryProducts("unknown"));
        verify(productRepository, never()).findStorefrontProductsByCategory(anyLong());
    }

    @Test
    @DisplayName("카테고리 상품 - 비활성 카테고리는 찾을 수 없음")
    void testGetCategoryProducts_Inactive() {
        Category hidden = Category.builder()
                .categoryId(200L)
                .name("Seasonal")
                .slug("seasonal")
                .active(false)
                .build();
        when(categoryRepository.findBySlug("seasonal")).thenReturn(Optional.of(hidden));

        assertThrows(CategoryNotFoundException.class, () -> catalogService.getCategoryProducts("seasonal"));
    }
}
