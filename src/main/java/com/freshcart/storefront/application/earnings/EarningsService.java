package com.freshcart.storefront.application.earnings;

import com.freshcart.storefront.application.vendor.VendorAccessGuard;
import com.freshcart.storefront.domain.category.Category;
import com.freshcart.storefront.domain.category.CategoryRepository;
import com.freshcart.storefront.domain.common.vo.Money;
import com.freshcart.storefront.domain.order.OrderItem;
import com.freshcart.storefront.domain.order.OrderItemRepository;
import com.freshcart.storefront.domain.order.OrderItemSearchCondition;
import com.freshcart.storefront.domain.order.OrderItemStatus;
import com.freshcart.storefront.domain.product.Product;
import com.freshcart.storefront.domain.product.ProductRepository;
import com.freshcart.storefront.domain.vendor.Vendor;
import com.freshcart.storefront.infrastructure.config.StorefrontProperties;
import com.freshcart.storefront.presentation.vendor.response.CategoryEarningsResponse;
import com.freshcart.storefront.presentation.vendor.response.EarningsReportResponse;
import com.freshcart.storefront.presentation.vendor.response.ProductEarningsResponse;
import com.freshcart.storefront.presentation.vendor.response.VendorOrderItemResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 판매자 매출 리포트 서비스
 *
 * 집계 대상: 본인 상품의 배송 완료(DELIVERED) 주문 항목
 * 매출 = Σ 수량 × 주문 시점 단가
 */
@Service
public class EarningsService {

    private static final Logger log = LoggerFactory.getLogger(EarningsService.class);

    static final String CSV_HEADER = "Order ID,Product,Quantity,Price,Total,Status,Date";
    private static final DateTimeFormatter FILE_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final DateTimeFormatter ROW_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
    private static final String UNCATEGORIZED = "미분류";

    private final VendorAccessGuard vendorAccessGuard;
    private final OrderItemRepository orderItemRepository;
    private final ProductRepository productRepository;
    private final CategoryRepository categoryRepository;
    private final StorefrontProperties properties;

    public EarningsService(VendorAccessGuard vendorAccessGuard,
                           OrderItemRepository orderItemRepository,
                           ProductRepository productRepository,
                           CategoryRepository categoryRepository,
                           StorefrontProperties properties) {
        this.vendorAccessGuard = vendorAccessGuard;
        this.orderItemRepository = orderItemRepository;
        this.productRepository = productRepository;
        this.categoryRepository = categoryRepository;
        this.properties = properties;
    }

    @Transactional(readOnly = true)
    public EarningsReportResponse getReport(Long userId, EarningsFilter filter) {
        Vendor vendor = vendorAccessGuard.requireApprovedVendor(userId);
        List<OrderItem> items = findDeliveredItems(vendor, filter);

        Money totalRevenue = items.stream()
                .map(OrderItem::getLineTotal)
                .reduce(Money.ZERO, Money::add);
        long totalItemsSold = items.stream()
                .mapToLong(OrderItem::getQuantity)
                .sum();

        return EarningsReportResponse.builder()
                .dateFrom(filter.getDateFrom())
                .dateTo(filter.getDateTo())
                .productId(filter.getProductId())
                .categoryId(filter.getCategoryId())
                .totalRevenue(totalRevenue.getAmount())
                .totalItemsSold(totalItemsSold)
                .totalOrders(items.size())
                .revenueByProduct(revenueByProduct(items))
                .revenueByCategory(revenueByCategory(items))
                .items(items.stream().map(VendorOrderItemResponse::from).collect(Collectors.toList()))
                .build();
    }

    /**
     * 리포트와 같은 행을 CSV로 내보낸다.
     * Date 열은 주문 항목 생성 시각(yyyy-MM-dd HH:mm)이다.
     * 파일명: sales_report_{상점 슬러그}_{yyyyMMdd}.csv
     */
    @Transactional(readOnly = true)
    public EarningsCsvFile exportCsv(Long userId, EarningsFilter filter) {
        Vendor vendor = vendorAccessGuard.requireApprovedVendor(userId);
        List<OrderItem> items = findDeliveredItems(vendor, filter);

        StringBuilder csv = new StringBuilder(CSV_HEADER).append("\r\n");
        for (OrderItem item : items) {
            csv.append(item.getOrderId()).append(',')
                    .append(escape(item.getProductName())).append(',')
                    .append(item.getQuantity()).append(',')
                    .append(item.getUnitPrice().toPlainString()).append(',')
                    .append(item.getLineTotal()).append(',')
                    .append(item.getStatus().name()).append(',')
                    .append(item.getCreatedAt().format(ROW_DATE))
                    .append("\r\n");
        }

        String filename = String.format("sales_report_%s_%s.csv", vendor.getSlug(), LocalDate.now().format(FILE_DATE));
        log.info("[EarningsService] 매출 CSV 내보내기 - vendorId={}, rows={}", vendor.getVendorId(), items.size());
        return new EarningsCsvFile(filename, csv.toString());
    }

    private List<OrderItem> findDeliveredItems(Vendor vendor, EarningsFilter filter) {
        List<Long> categoryProductIds = null;
        if (filter.getCategoryId() != null) {
            categoryProductIds = productRepository.findIdsByVendorAndCategory(vendor.getVendorId(), filter.getCategoryId());
        }

        OrderItemSearchCondition condition = OrderItemSearchCondition.builder()
                .vendorId(vendor.getVendorId())
                .status(OrderItemStatus.DELIVERED)
                .statusChangedFrom(filter.getDateFrom() != null ? filter.getDateFrom().atStartOfDay() : null)
                .statusChangedTo(filter.getDateTo() != null ? filter.getDateTo().plusDays(1).atStartOfDay() : null)
                .productId(filter.getProductId())
                .productIds(categoryProductIds)
                .build();
        return orderItemRepository.search(condition);
    }

    private List<ProductEarningsResponse> revenueByProduct(List<OrderItem> items) {
        Map<Long, List<OrderItem>> byProduct = items.stream()
                .collect(Collectors.groupingBy(OrderItem::getProductId, LinkedHashMap::new, Collectors.toList()));

        return byProduct.entrySet().stream()
                .map(entry -> ProductEarningsResponse.builder()
                        .productId(entry.getKey())
                        .productName(entry.getValue().get(0).getProductName())
                        .quantitySold(sumQuantity(entry.getValue()))
                        .revenue(sumRevenue(entry.getValue()).getAmount())
                        .build())
                .sorted(Comparator.comparing(ProductEarningsResponse::getRevenue).reversed())
                .limit(properties.getVendor().getEarningsTopProducts())
                .collect(Collectors.toList());
    }

    private List<CategoryEarningsResponse> revenueByCategory(List<OrderItem> items) {
        if (items.isEmpty()) {
            return Collections.emptyList();
        }
        Map<Long, Product> products = productRepository.findAllById(items.stream()
                        .map(OrderItem::getProductId)
                        .distinct()
                        .collect(Collectors.toList()))
                .stream()
                .collect(Collectors.toMap(Product::getProductId, Function.identity()));
        Map<Long, Category> categories = categoryRepository.findAllById(products.values().stream()
                        .map(Product::getCategoryId)
                        .distinct()
                        .collect(Collectors.toList()))
                .stream()
                .collect(Collectors.toMap(Category::getCategoryId, Function.identity()));

        Map<Long, List<OrderItem>> byCategory = new LinkedHashMap<>();
        for (OrderItem item : items) {
            Product product = products.get(item.getProductId());
            Long categoryId = product != null ? product.getCategoryId() : null;
            byCategory.computeIfAbsent(categoryId, key -> new ArrayList<>()).add(item);
        }

        return byCategory.entrySet().stream()
                .map(entry -> {
                    Category category = entry.getKey() != null ? categories.get(entry.getKey()) : null;
                    return CategoryEarningsResponse.builder()
                            .categoryId(entry.getKey())
                            .categoryName(category != null ? category.getName() : UNCATEGORIZED)
                            .quantitySold(sumQuantity(entry.getValue()))
                            .revenue(sumRevenue(entry.getValue()).getAmount())
                            .build();
                })
                .sorted(Comparator.comparing(CategoryEarningsResponse::getRevenue).reversed())
                .collect(Collectors.toList());
    }

    private static long sumQuantity(List<OrderItem> items) {
        return items.stream().mapToLong(OrderItem::getQuantity).sum();
    }

    private static Money sumRevenue(List<OrderItem> items) {
        return items.stream().map(OrderItem::getLineTotal).reduce(Money.ZERO, Money::add);
    }

    /**
     * 쉼표, 따옴표, 줄바꿈이 있으면 큰따옴표로 감싼다.
     */
    static String escape(String value) {
        if (value == null) {
            return "";
        }
        if (value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
