package com.freshcart.storefront.domain.order;

import lombok.Builder;
import lombok.Getter;

import java.time.LocalDateTime;
import java.util.Collection;

/**
 * 판매자 주문 항목 조회 조건
 *
 * null인 조건은 적용하지 않는다.
 * 날짜 범위는 [from, to) 반개구간이다.
 */
@Getter
@Builder
public class OrderItemSearchCondition {
    private final Long vendorId;
    private final OrderItemStatus status;
    private final LocalDateTime createdFrom;
    private final LocalDateTime createdTo;
    private final LocalDateTime statusChangedFrom;
    private final LocalDateTime statusChangedTo;
    private final Long productId;
    private final Collection<Long> productIds;
}
