package com.freshcart.storefront.application.product;

import com.freshcart.storefront.application.vendor.VendorAccessGuard;
import com.freshcart.storefront.common.exception.ForbiddenException;
import com.freshcart.storefront.common.exception.ValidationException;
import com.freshcart.storefront.common.util.SlugUtils;
import com.freshcart.storefront.domain.cart.CartRepository;
import com.freshcart.storefront.domain.category.Category;
import com.freshcart.storefront.domain.category.CategoryRepository;
import com.freshcart.storefront.domain.order.OrderItemRepository;
import com.freshcart.storefront.domain.product.Product;
import com.freshcart.storefront.domain.product.ProductNotFoundException;
import com.freshcart.storefront.domain.product.ProductRepository;
import com.freshcart.storefront.domain.vendor.Vendor;
import com.freshcart.storefront.presentation.vendor.request.ProductFormRequest;
import com.freshcart.storefront.presentation.vendor.response.ProductDeleteResponse;
import com.freshcart.storefront.presentation.vendor.response.VendorProductResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 판매자 상품 관리 서비스
 *
 * 모든 작업은 승인된 판매자 본인의 상품에 대해서만 수행된다.
 * 동시 수정은 마지막 저장이 반영된다.
 */
@Service
public class VendorProductService {

    private static final Logger log = LoggerFactory.getLogger(VendorProductService.class);

    static final String AVAILABILITY_AVAILABLE = "available";
    static final String AVAILABILITY_UNAVAILABLE = "unavailable";

    private final VendorAccessGuard vendorAccessGuard;
    private final ProductRepository productRepository;
    private final CategoryRepository categoryRepository;
    private final CartRepository cartRepository;
    private final OrderItemRepository orderItemRepository;
    private final ProductFormValidator productFormValidator;

    public VendorProductService(VendorAccessGuard vendorAccessGuard,
                                ProductRepository productRepository,
                                CategoryRepository categoryRepository,
                                CartRepository cartRepository,
                                OrderItemRepository orderItemRepository,
                                ProductFormValidator productFormValidator) {
        this.vendorAccessGuard = vendorAccessGuard;
        this.productRepository = productRepository;
        this.categoryRepository = categoryRepository;
        this.cartRepository = cartRepository;
        this.orderItemRepository = orderItemRepository;
        this.productFormValidator = productFormValidator;
    }

    /**
     * 본인 상품 목록 (최신순)
     *
     * @param categoryId 카테고리 필터 (null이면 전체)
     * @param availability "available" | "unavailable" (null 또는 빈 값이면 전체)
     */
    @Transactional(readOnly = true)
    public List<VendorProductResponse> getProducts(Long userId, Long categoryId, String availability) {
        Vendor vendor = vendorAccessGuard.requireApprovedVendor(userId);
        Boolean available = parseAvailability(availability);

        List<Product> products = productRepository.findByVendor(vendor.getVendorId(), categoryId, available);
        Map<Long, String> categoryNames = categoryNames(products);

        return products.stream()
                .map(product -> VendorProductResponse.from(product, categoryNames.get(product.getCategoryId())))
                .collect(Collectors.toList());
    }

    @Transactional
    public VendorProductResponse addProduct(Long userId, ProductFormRequest request) {
        Vendor vendor = vendorAccessGuard.requireApprovedVendor(userId);
        ProductFormValidator.ValidatedProduct validated = productFormValidator.validate(request);

        String slug = SlugUtils.generateAvailableSlug(validated.getDetails().getName(), productRepository::existsBySlug);
        Product saved = productRepository.save(
                Product.create(vendor.getVendorId(), validated.getCategory().getCategoryId(), slug, validated.getDetails()));

        log.info("[VendorProductService] 상품 등록 - vendorId={}, productId={}, slug={}",
                vendor.getVendorId(), saved.getProductId(), slug);
        return VendorProductResponse.from(saved, validated.getCategory().getName());
    }

    @Transactional(readOnly = true)
    public VendorProductResponse getProduct(Long userId, String slug) {
        Vendor vendor = vendorAccessGuard.requireApprovedVendor(userId);
        Product product = findOwnedProduct(vendor, slug);
        return VendorProductResponse.from(product, categoryName(product.getCategoryId()));
    }

    /**
     * 상품 수정 (슬러그 유지)
     */
    @Transactional
    public VendorProductResponse editProduct(Long userId, String slug, ProductFormRequest request) {
        Vendor vendor = vendorAccessGuard.requireApprovedVendor(userId);
        Product product = findOwnedProduct(vendor, slug);
        ProductFormValidator.ValidatedProduct validated = productFormValidator.validate(request);

        product.update(validated.getCategory().getCategoryId(), validated.getDetails());
        Product saved = productRepository.save(product);
        return VendorProductResponse.from(saved, validated.getCategory().getName());
    }

    /**
     * 상품 삭제
     * 장바구니 라인은 항상 제거한다. 주문 이력이 있으면 행을 지우지 않고 판매 중단 처리한다.
     */
    @Transactional
    public ProductDeleteResponse deleteProduct(Long userId, String slug) {
        Vendor vendor = vendorAccessGuard.requireApprovedVendor(userId);
        Product product = findOwnedProduct(vendor, slug);

        int removedCartItems = cartRepository.deleteCartItemsByProductId(product.getProductId());

        String result;
        if (orderItemRepository.existsByProductId(product.getProductId())) {
            product.retire();
            productRepository.save(product);
            result = ProductDeleteResponse.RETIRED;
        } else {
            productRepository.delete(product);
            result = ProductDeleteResponse.DELETED;
        }

        log.info("[VendorProductService] 상품 삭제 - productId={}, result={}, removedCartItems={}",
                product.getProductId(), result, removedCartItems);

        return ProductDeleteResponse.builder()
                .slug(slug)
                .result(result)
                .removedCartItems(removedCartItems)
                .build();
    }

    @Transactional
    public VendorProductResponse toggleAvailability(Long userId, String slug) {
        Vendor vendor = vendorAccessGuard.requireApprovedVendor(userId);
        Product product = findOwnedProduct(vendor, slug);
        product.toggleAvailability();
        Product saved = productRepository.save(product);
        return VendorProductResponse.from(saved, categoryName(saved.getCategoryId()));
    }

    private Product findOwnedProduct(Vendor vendor, String slug) {
        Product product = productRepository.findBySlug(slug)
                .orElseThrow(() -> new ProductNotFoundException(slug));
        if (!product.isOwnedBy(vendor.getVendorId())) {
            log.warn("[VendorProductService] 타 판매자 상품 접근 - vendorId={}, slug={}", vendor.getVendorId(), slug);
            throw new ForbiddenException(String.format("slug: %s", slug));
        }
        return product;
    }

    private static Boolean parseAvailability(String availability) {
        if (availability == null || availability.isBlank()) {
            return null;
        }
        if (AVAILABILITY_AVAILABLE.equals(availability)) {
            return Boolean.TRUE;
        }
        if (AVAILABILITY_UNAVAILABLE.equals(availability)) {
            return Boolean.FALSE;
        }
        throw new ValidationException("availability", "availability는 available 또는 unavailable이어야 합니다");
    }

    private String categoryName(Long categoryId) {
        return categoryRepository.findById(categoryId)
                .map(Category::getName)
                .orElse(null);
    }

    private Map<Long, String> categoryNames(List<Product> products) {
        return categoryRepository.findAllById(products.stream()
                        .map(Product::getCategoryId)
                        .distinct()
                        .collect(Collectors.toList()))
                .stream()
                .collect(Collectors.toMap(Category::getCategoryId, Category::getName));
    }
}
