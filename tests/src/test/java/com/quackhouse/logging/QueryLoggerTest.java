package com.quackhouse.logging;

import com.quackhouse.auth.Principal;
import com.quackhouse.support.TestBase;
import com.quackhouse.support.TestCategories;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.assertj.core.api.Assertions.*;

@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("Query Logger")
public class QueryLoggerTest extends TestBase {

    @AfterEach
    void clear() {
        QueryLogger.clearContext();
    }

    @Test
    @DisplayName("Query ids are short and distinct")
    void queryIds() {
        String first = QueryLogger.newQueryId();

        assertThat(first).startsWith("q_").hasSize(10);
        assertThat(QueryLogger.newQueryId()).isNotEqualTo(first);
    }

    @Test
    @DisplayName("Context carries the query id and principal until cleared")
    void context() {
        QueryLogger.startQuery("q_12345678", Principal.user(7), "SELECT 1");

        assertThat(QueryLogger.currentQueryId()).isEqualTo("q_12345678");
        assertThat(MDC.get(QueryLogger.PRINCIPAL)).isNotBlank();

        QueryLogger.clearContext();

        assertThat(QueryLogger.currentQueryId()).isNull();
        assertThat(MDC.get(QueryLogger.PRINCIPAL)).isNull();
    }

    @Test
    @DisplayName("Long statements are abbreviated")
    void abbreviate() {
        String sql = "SELECT " + "x, ".repeat(400) + "1";

        assertThat(QueryLogger.abbreviate(sql)).hasSizeLessThan(sql.length()).startsWith("SELECT x, x,");
        assertThat(QueryLogger.abbreviate("SELECT 1")).isEqualTo("SELECT 1");
    }
}
