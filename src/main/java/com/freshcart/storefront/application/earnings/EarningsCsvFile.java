package com.freshcart.storefront.application.earnings;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 매출 CSV 내보내기 결과
 */
@Getter
@AllArgsConstructor
public class EarningsCsvFile {
    private final String filename;
    private final String content;
}
