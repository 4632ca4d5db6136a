package com.freshcart.storefront.common.exception;

/**
 * ErrorCode - 비즈니스 예외 코드 정의
 *
 * 역할:
 * - 모든 비즈니스 예외의 코드와 메시지 정의
 * - HTTP 상태 코드 매핑
 * - 일관된 에러 응답 제공
 *
 * 코드 형식: {LAYER}_{DOMAIN}_{ERROR}
 * 예: DOMAIN_VENDOR_NOT_APPROVED, APP_ORDER_PERSISTENCE_FAILED
 */
public enum ErrorCode {

    // ========== Domain Layer Errors (4XX) ==========

    // Common
    VALIDATION_FAILED("DOMAIN_VALIDATION_FAILED", "입력값이 올바르지 않습니다", 400),
    FORBIDDEN("DOMAIN_FORBIDDEN", "해당 리소스에 대한 권한이 없습니다", 403),
    INVALID_STATUS_TRANSITION("DOMAIN_INVALID_STATUS_TRANSITION", "허용되지 않는 상태 전이입니다", 409),

    // User Domain
    USER_NOT_FOUND("DOMAIN_USER_NOT_FOUND", "사용자를 찾을 수 없습니다", 404),

    // Category Domain
    CATEGORY_NOT_FOUND("DOMAIN_CATEGORY_NOT_FOUND", "카테고리를 찾을 수 없습니다", 404),

    // Product Domain
    PRODUCT_NOT_FOUND("DOMAIN_PRODUCT_NOT_FOUND", "상품을 찾을 수 없습니다", 404),

    // Vendor Domain
    VENDOR_NOT_FOUND("DOMAIN_VENDOR_NOT_FOUND", "판매자 정보를 찾을 수 없습니다", 404),
    VENDOR_NOT_APPROVED("DOMAIN_VENDOR_NOT_APPROVED", "승인되지 않은 판매자입니다", 403),

    // Cart Domain
    CART_ITEM_NOT_FOUND("DOMAIN_CART_ITEM_NOT_FOUND", "장바구니 항목을 찾을 수 없습니다", 404),
    CART_INVALID_QUANTITY("DOMAIN_CART_INVALID_QUANTITY", "수량은 1 이상 1000 이하여야 합니다", 400),
    CART_EMPTY("DOMAIN_CART_EMPTY", "장바구니가 비어 있습니다", 400),

    // Order Domain
    ORDER_ITEM_NOT_FOUND("DOMAIN_ORDER_ITEM_NOT_FOUND", "주문 항목을 찾을 수 없습니다", 404),

    // ========== Application Layer Errors (5XX) ==========

    ORDER_PERSISTENCE_FAILED("APP_ORDER_PERSISTENCE_FAILED", "주문 저장에 실패했습니다", 500),

    // ========== System Errors (5XX) ==========

    DATABASE_ERROR("SYSTEM_DATABASE_ERROR", "데이터베이스 오류가 발생했습니다", 500),
    INTERNAL_SERVER_ERROR("SYSTEM_INTERNAL_SERVER_ERROR", "서버 내부 오류가 발생했습니다", 500);

    private final String code;
    private final String message;
    private final int statusCode;

    ErrorCode(String code, String message, int statusCode) {
        this.code = code;
        this.message = message;
        this.statusCode = statusCode;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
