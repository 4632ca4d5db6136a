package com.freshcart.storefront.application.earnings;

import lombok.Builder;
import lombok.Getter;

import java.time.LocalDate;

/**
 * 매출 조회 필터 (null인 조건은 적용하지 않음)
 * 날짜는 배송 완료일 기준이며 양 끝을 포함한다.
 */
@Getter
@Builder
public class EarningsFilter {
    private final LocalDate dateFrom;
    private final LocalDate dateTo;
    private final Long productId;
    private final Long categoryId;

    public static EarningsFilter empty() {
        return EarningsFilter.builder().build();
    }
}
