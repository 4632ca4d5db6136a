package com.freshcart.storefront.common.util;

import java.text.Normalizer;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * URL 슬러그 생성 유틸리티
 *
 * 카테고리, 상품, 판매자 상점명에서 슬러그를 만든다.
 * 예: "Dairy, Bread & Eggs" → "dairy-bread-eggs"
 */
public final class SlugUtils {

    private static final Pattern NON_LATIN = Pattern.compile("[^\\w-]");
    private static final Pattern WHITESPACE = Pattern.compile("[\\s]");
    private static final Pattern MULTIPLE_HYPHENS = Pattern.compile("-+");
    private static final int MAX_LENGTH = 100;
    private static final String FALLBACK = "item";

    private SlugUtils() {
    }

    /**
     * 문자열을 URL 친화적인 슬러그로 변환한다.
     *
     * @param input 원본 문자열 (상품명, 상점명 등)
     * @return 소문자, 하이픈 구분 슬러그 (변환 결과가 비면 빈 문자열)
     */
    public static String generateSlug(String input) {
        if (input == null || input.trim().isEmpty()) {
            return "";
        }

        String slug = input.trim().toLowerCase(Locale.ENGLISH);
        slug = Normalizer.normalize(slug, Normalizer.Form.NFD);
        slug = WHITESPACE.matcher(slug).replaceAll("-");
        slug = NON_LATIN.matcher(slug).replaceAll("");
        slug = MULTIPLE_HYPHENS.matcher(slug).replaceAll("-");
        slug = slug.replaceAll("^-+|-+$", "");

        if (slug.length() > MAX_LENGTH) {
            slug = slug.substring(0, MAX_LENGTH);
            int lastHyphen = slug.lastIndexOf('-');
            if (lastHyphen > MAX_LENGTH / 2) {
                slug = slug.substring(0, lastHyphen);
            }
        }
        return slug;
    }

    /**
     * 기본 슬러그에 번호를 붙인다. (counter가 1 이하면 그대로)
     */
    public static String generateUniqueSlug(String baseSlug, int counter) {
        return counter <= 1 ? baseSlug : baseSlug + "-" + counter;
    }

    /**
     * 이미 사용 중인 슬러그를 피해 고유한 슬러그를 만든다.
     * "fresh-milk"가 있으면 "fresh-milk-2", "fresh-milk-3" 순으로 시도한다.
     *
     * @param input 원본 문자열
     * @param taken 슬러그 사용 여부 판별 함수
     * @return 사용되지 않은 슬러그
     */
    public static String generateAvailableSlug(String input, Predicate<String> taken) {
        String base = generateSlug(input);
        if (base.isEmpty()) {
            base = FALLBACK;
        }
        int counter = 1;
        String candidate = base;
        while (taken.test(candidate)) {
            counter++;
            candidate = generateUniqueSlug(base, counter);
        }
        return candidate;
    }
}
