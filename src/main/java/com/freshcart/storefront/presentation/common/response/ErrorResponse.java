package com.freshcart.storefront.presentation.common.response;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * 통일된 에러 응답 DTO
 *
 * errors: 필드별 검증 메시지 (검증 실패 시에만)
 * vendor_status, redirect_url: 미승인 판매자 접근 시에만
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    @JsonProperty("error_code")
    private String errorCode;

    @JsonProperty("error_message")
    private String errorMessage;

    @JsonProperty("errors")
    private Map<String, String> errors;

    @JsonProperty("vendor_status")
    private String vendorStatus;

    @JsonProperty("redirect_url")
    private String redirectUrl;

    @JsonProperty("timestamp")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant timestamp;

    @JsonProperty("request_id")
    private String requestId;

    /**
     * 에러 응답 생성 헬퍼 메서드
     */
    public static ErrorResponse of(String errorCode, String errorMessage) {
        return baseBuilder(errorCode, errorMessage).build();
    }

    public static ErrorResponse withFieldErrors(String errorCode, String errorMessage, Map<String, String> errors) {
        return baseBuilder(errorCode, errorMessage)
                .errors(errors)
                .build();
    }

    public static ErrorResponse withRedirect(String errorCode, String errorMessage,
                                             String vendorStatus, String redirectUrl) {
        return baseBuilder(errorCode, errorMessage)
                .vendorStatus(vendorStatus)
                .redirectUrl(redirectUrl)
                .build();
    }

    private static ErrorResponseBuilder baseBuilder(String errorCode, String errorMessage) {
        return ErrorResponse.builder()
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .timestamp(Instant.now())
                .requestId("req-" + UUID.randomUUID().toString().substring(0, 12));
    }
}
