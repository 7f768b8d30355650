package com.hhplus.storefront.infrastructure.config.database;

import com.p6spy.engine.spy.appender.MessageFormattingStrategy;
import org.hibernate.engine.jdbc.internal.FormatStyle;

import java.util.Locale;

/**
 * P6Spy 로그 포맷
 *
 * - DDL(create/alter/drop)은 FormatStyle.DDL, 나머지는 FormatStyle.BASIC으로 줄바꿈
 * - 잠금 조회(for update)는 헤더에 표시하여 상태 변경 경합을 로그에서 바로 구분
 */
public class P6SpyPrettySqlFormatter implements MessageFormattingStrategy {

    @Override
    public String formatMessage(int connectionId, String now, long elapsed,
                                String category, String prepared, String sql, String url) {
        if (sql == null || sql.isBlank()) {
            return "";
        }
        String normalized = sql.trim().replaceAll("\\s+", " ");
        String lower = normalized.toLowerCase(Locale.ROOT);

        String formatted;
        try {
            formatted = isDdl(lower)
                    ? FormatStyle.DDL.getFormatter().format(normalized)
                    : FormatStyle.BASIC.getFormatter().format(normalized);
        } catch (RuntimeException e) {
            formatted = normalized;
        }

        String lockMarker = lower.contains(" for update") ? " [LOCK]" : "";
        return String.format("%n[P6Spy] conn=%d, category=%s, elapsed=%dms%s%s",
                connectionId, category, elapsed, lockMarker, formatted);
    }

    private boolean isDdl(String lowerSql) {
        return lowerSql.startsWith("create") || lowerSql.startsWith("alter") || lowerSql.startsWith("drop");
    }
}
