package com.freshcart.storefront.infrastructure.config.database;

import com.p6spy.engine.logging.Category;
import com.p6spy.engine.spy.appender.MessageFormattingStrategy;
import org.hibernate.engine.jdbc.internal.FormatStyle;

import java.util.Locale;

/**
 * P6Spy 로그 포맷 커스터마이징 클래스
 *
 * "완성된 SQL + 바인딩된 인자" 형태로 SQL을 출력한다.
 * DDL은 FormatStyle.DDL, 나머지는 FormatStyle.BASIC으로 정렬한다.
 */
public class P6SpyPrettySqlFormatter implements MessageFormattingStrategy {

    @Override
    public String formatMessage(int connectionId, String now, long elapsed, String category,
                                String prepared, String sql, String url) {
        if (sql == null || sql.isBlank()) {
            return "";
        }
        return buildLogMessage(format(sql.trim(), category), connectionId, elapsed, category);
    }

    private String format(String sql, String category) {
        if (!Category.STATEMENT.getName().equals(category)) {
            return sql;
        }
        String lower = sql.toLowerCase(Locale.ROOT);
        if (lower.startsWith("create") || lower.startsWith("alter") || lower.startsWith("comment")) {
            return FormatStyle.DDL.getFormatter().format(sql);
        }
        return FormatStyle.BASIC.getFormatter().format(sql);
    }

    private String buildLogMessage(String sql, int connectionId, long elapsed, String category) {
        StringBuilder sb = new StringBuilder();
        sb.append("\n");
        sb.append("================== P6Spy SQL Logger ==================\n");
        sb.append("Connection : ").append(connectionId).append("\n");
        sb.append("Category   : ").append(category).append("\n");
        sb.append("Elapsed    : ").append(elapsed).append("ms\n");
        sb.append("SQL        :").append(sql).append("\n");
        sb.append("======================================================\n");
        return sb.toString();
    }
}
