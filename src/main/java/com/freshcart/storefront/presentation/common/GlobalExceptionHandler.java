package com.freshcart.storefront.presentation.common;

import com.freshcart.storefront.application.order.OrderPersistenceException;
import com.freshcart.storefront.common.exception.BizException;
import com.freshcart.storefront.common.exception.ErrorCode;
import com.freshcart.storefront.common.exception.ValidationException;
import com.freshcart.storefront.domain.vendor.VendorNotApprovedException;
import com.freshcart.storefront.presentation.common.response.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;

/**
 * GlobalExceptionHandler - 전역 예외 처리 (Presentation 계층)
 *
 * 에러 응답 형식:
 * {
 *   "error_code": "DOMAIN_VALIDATION_FAILED",
 *   "error_message": "입력값이 올바르지 않습니다",
 *   "errors": { "phone": "전화번호를 입력해주세요" },
 *   "timestamp": "2025-11-07T12:34:56.000Z",
 *   "request_id": "req-abc123def456"
 * }
 *
 * HTTP 상태 코드는 ErrorCode의 statusCode를 따른다.
 * - 400: 검증 실패, 빈 장바구니, 수량 범위 초과
 * - 403: 타 판매자 리소스 접근, 미승인 판매자
 * - 404: 리소스 없음
 * - 409: 허용되지 않은 상태 전이
 * - 500: 주문 저장 실패, 서버 내부 오류
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * 입력값 검증 실패 (400) - 필드별 메시지 포함
     */
    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(ValidationException e) {
        logger.warn("[GlobalExceptionHandler] 검증 실패 - fields={}", e.getFieldErrors().keySet());
        ErrorResponse errorResponse = ErrorResponse.withFieldErrors(
                e.getErrorCodeValue(), e.getErrorCode().getMessage(), e.getFieldErrors());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse);
    }

    /**
     * 미승인 판매자 접근 (403) - 승인 대기 안내 경로 포함
     */
    @ExceptionHandler(VendorNotApprovedException.class)
    public ResponseEntity<ErrorResponse> handleVendorNotApprovedException(VendorNotApprovedException e) {
        ErrorResponse errorResponse = ErrorResponse.withRedirect(
                e.getErrorCodeValue(), e.getMessage(), e.getVendorStatus().name(), e.getRedirectUrl());
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(errorResponse);
    }

    /**
     * 주문 저장 실패 (500) - 트랜잭션은 롤백되고 장바구니는 유지된다.
     */
    @ExceptionHandler(OrderPersistenceException.class)
    public ResponseEntity<ErrorResponse> handleOrderPersistenceException(OrderPersistenceException e) {
        logger.error("[GlobalExceptionHandler] 주문 저장 실패 - userId={}", e.getUserId(), e);
        ErrorResponse errorResponse = ErrorResponse.of(e.getErrorCodeValue(), e.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }

    /**
     * 그 외 비즈니스 예외 (ErrorCode의 상태 코드 사용)
     */
    @ExceptionHandler(BizException.class)
    public ResponseEntity<ErrorResponse> handleBizException(BizException e) {
        if (e.getStatusCode() >= 500) {
            logger.error("[GlobalExceptionHandler] {}", e.getMessage(), e);
        } else {
            logger.warn("[GlobalExceptionHandler] {} - {}", e.getErrorCodeValue(), e.getMessage());
        }
        ErrorResponse errorResponse = ErrorResponse.of(e.getErrorCodeValue(), e.getMessage());
        return ResponseEntity.status(e.getStatusCode()).body(errorResponse);
    }

    /**
     * 필수 헤더 누락 (X-USER-ID) (400)
     */
    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingRequestHeaderException(MissingRequestHeaderException e) {
        return badRequest(e.getHeaderName(), "필수 헤더가 없습니다");
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameterException(MissingServletRequestParameterException e) {
        return badRequest(e.getParameterName(), "필수 파라미터가 없습니다");
    }

    /**
     * 경로/파라미터 타입 불일치 (400) - 예: 날짜 형식 오류
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatchException(MethodArgumentTypeMismatchException e) {
        return badRequest(e.getName(), "형식이 올바르지 않습니다");
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleHttpMessageNotReadableException(HttpMessageNotReadableException e) {
        return badRequest("body", "요청 본문을 읽을 수 없습니다");
    }

    /**
     * 서버 내부 오류 (500)
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        logger.error("Unhandled exception occurred: ", e);
        ErrorResponse errorResponse = ErrorResponse.of(
                ErrorCode.INTERNAL_SERVER_ERROR.getCode(), ErrorCode.INTERNAL_SERVER_ERROR.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }

    private ResponseEntity<ErrorResponse> badRequest(String field, String message) {
        ErrorResponse errorResponse = ErrorResponse.withFieldErrors(
                ErrorCode.VALIDATION_FAILED.getCode(), ErrorCode.VALIDATION_FAILED.getMessage(),
                Map.of(field, message));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse);
    }
}
