package com.metricsql.exception;

import com.metricsql.test.TestBase;
import com.metricsql.test.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@TestCategories.Tier2
@TestCategories.Unit
@DisplayName("Exception Message Tests")
public class ExceptionMessagesTest extends TestBase {

    private static QueryExecutionException failure(String message) {
        return new QueryExecutionException(message, new SQLException(message), "SELECT 1", List.of("x"));
    }

    @Test
    @DisplayName("Missing columns are named")
    void testMissingColumn() {
        assertThat(failure("Binder Error: Referenced column \"views\" not found in FROM clause!")
            .getUserMessage()).isEqualTo("Column 'views' used by the metrics view does not exist.");
    }

    @Test
    @DisplayName("Missing tables are named")
    void testMissingTable() {
        assertThat(failure("Catalog Error: Table with name events does not exist!").getUserMessage())
            .isEqualTo("Table events of the metrics view does not exist.");
    }

    @Test
    @DisplayName("Technical message carries SQL and arguments")
    void testTechnicalMessage() {
        String message = failure("Conversion Error: Could not convert string 'x' to INT32").getTechnicalMessage();

        assertThat(message).contains("QueryExecutionException", "Failed SQL:\nSELECT 1", "Args: [x]");
    }

    @Test
    @DisplayName("Rewrite and validation errors name where they failed")
    void testUserMessages() {
        assertThat(new RewriteException("boom", "RowCapEnforcement"))
            .hasMessage("boom (pass: RowCapEnforcement)");
        assertThat(new RewriteException("boom", "RowCapEnforcement").getUserMessage())
            .contains("RowCapEnforcement");
        assertThat(new ValidationException("bad", "sort").getUserMessage()).contains("'sort'");
    }
}
