package com.smurthy.ai.derma.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class RetrievalConfigurationTest {

    @Test
    @DisplayName("Should give vector store queries a database-side timeout rounded up to whole seconds")
    void testQueryTimeout() {
        // When
        JdbcTemplate fractional = RetrievalConfiguration.queryTimeoutTemplate(mock(DataSource.class), Duration.ofMillis(2500));
        JdbcTemplate tiny = RetrievalConfiguration.queryTimeoutTemplate(mock(DataSource.class), Duration.ofMillis(200));

        // Then
        assertThat(fractional.getQueryTimeout()).isEqualTo(3);
        assertThat(tiny.getQueryTimeout()).isEqualTo(1);
    }
}
