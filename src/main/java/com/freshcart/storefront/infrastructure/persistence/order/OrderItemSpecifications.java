package com.freshcart.storefront.infrastructure.persistence.order;

import com.freshcart.storefront.domain.order.OrderItem;
import com.freshcart.storefront.domain.order.OrderItemSearchCondition;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;

import java.util.ArrayList;
import java.util.List;

/**
 * 판매자 주문 항목 검색 조건 → JPA Specification 변환
 */
public final class OrderItemSpecifications {

    private OrderItemSpecifications() {
    }

    public static Specification<OrderItem> matching(OrderItemSearchCondition condition) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();

            if (condition.getVendorId() != null) {
                predicates.add(cb.equal(root.get("vendorId"), condition.getVendorId()));
            }
            if (condition.getStatus() != null) {
                predicates.add(cb.equal(root.get("status"), condition.getStatus()));
            }
            if (condition.getCreatedFrom() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.get("createdAt"), condition.getCreatedFrom()));
            }
            if (condition.getCreatedTo() != null) {
                predicates.add(cb.lessThan(root.get("createdAt"), condition.getCreatedTo()));
            }
            if (condition.getStatusChangedFrom() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.get("statusChangedAt"), condition.getStatusChangedFrom()));
            }
            if (condition.getStatusChangedTo() != null) {
                predicates.add(cb.lessThan(root.get("statusChangedAt"), condition.getStatusChangedTo()));
            }
            if (condition.getProductId() != null) {
                predicates.add(cb.equal(root.get("productId"), condition.getProductId()));
            }
            if (condition.getProductIds() != null) {
                if (condition.getProductIds().isEmpty()) {
                    predicates.add(cb.disjunction());
                } else {
                    predicates.add(root.get("productId").in(condition.getProductIds()));
                }
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
