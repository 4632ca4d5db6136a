package com.freshcart.storefront.infrastructure.config.database;

import com.p6spy.engine.spy.P6SpyOptions;
import jakarta.annotation.PostConstruct;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

/**
 * P6Spy 설정 클래스
 *
 * test 프로필에서만 활성화되며, 바인딩된 인자가 포함된 SQL을
 * P6SpyPrettySqlFormatter 형식으로 출력한다.
 */
@Configuration
@Profile("test")
public class P6SpyConfig {

    @PostConstruct
    public void setLogMessageFormat() {
        P6SpyOptions.getActiveInstance().setLogMessageFormat(P6SpyPrettySqlFormatter.class.getName());
    }
}
