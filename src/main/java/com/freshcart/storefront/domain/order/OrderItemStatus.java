package com.freshcart.storefront.domain.order;

import lombok.Getter;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * OrderItemStatus - 주문 항목 처리 상태 (판매자별 이행 상태)
 *
 * 상태 전환 규칙:
 * PLACED → CONFIRMED → PREPARING → OUT_FOR_DELIVERY → DELIVERED
 * PLACED | CONFIRMED | PREPARING | OUT_FOR_DELIVERY → CANCELLED
 * DELIVERED, CANCELLED는 최종 상태
 */
@Getter
public enum OrderItemStatus {
    PLACED("주문 접수"),
    CONFIRMED("주문 확인"),
    PREPARING("상품 준비중"),
    OUT_FOR_DELIVERY("배송중"),
    DELIVERED("배송 완료"),
    CANCELLED("주문 취소");

    private static final Map<OrderItemStatus, Set<OrderItemStatus>> TRANSITIONS = new EnumMap<>(OrderItemStatus.class);

    static {
        TRANSITIONS.put(PLACED, EnumSet.of(CONFIRMED, CANCELLED));
        TRANSITIONS.put(CONFIRMED, EnumSet.of(PREPARING, CANCELLED));
        TRANSITIONS.put(PREPARING, EnumSet.of(OUT_FOR_DELIVERY, CANCELLED));
        TRANSITIONS.put(OUT_FOR_DELIVERY, EnumSet.of(DELIVERED, CANCELLED));
        TRANSITIONS.put(DELIVERED, EnumSet.noneOf(OrderItemStatus.class));
        TRANSITIONS.put(CANCELLED, EnumSet.noneOf(OrderItemStatus.class));
    }

    private final String displayName;

    OrderItemStatus(String displayName) {
        this.displayName = displayName;
    }

    public boolean canTransitionTo(OrderItemStatus target) {
        return TRANSITIONS.get(this).contains(target);
    }

    public Set<OrderItemStatus> nextStatuses() {
        return Collections.unmodifiableSet(TRANSITIONS.get(this));
    }

    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }

    /**
     * 요청 문자열을 상태로 변환 ("out_for_delivery", "Delivered" 등, 대소문자 무시)
     */
    public static Optional<OrderItemStatus> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
        return Arrays.stream(values())
                .filter(status -> status.name().equals(normalized))
                .findFirst();
    }
}
