package com.freshcart.storefront;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableAsync;

/**
 * FreshCart 스토어프론트 애플리케이션 메인 클래스
 *
 * 활성화된 기능:
 * - @EnableAsync: 커밋 이후 고객 알림을 비동기로 발송
 * - @ConfigurationPropertiesScan: storefront.* 설정 바인딩
 */
@EnableAsync
@ConfigurationPropertiesScan
@SpringBootApplication
public class StorefrontApplication {

    public static void main(String[] args) {
        SpringApplication.run(StorefrontApplication.class, args);
    }

}
