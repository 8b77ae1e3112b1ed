package com.di.chunkmutator.aspect;

import com.di.chunkmutator.sql.SqlExecutionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.MethodSource;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.sql.SQLException;
import java.util.concurrent.TimeoutException;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for ErrorCategory enum.
 */
@DisplayName("ErrorCategory Tests")
class ErrorCategoryTest {

    // ============================================================================
    // SQL Exception Categorization Tests
    // ============================================================================

    @ParameterizedTest(name = "SQLSTATE {0} -> {1}")
    @CsvSource({
            "08001, CONNECTION_ERROR",
            "23505, CONSTRAINT_VIOLATION",
            "42P01, SQL_SYNTAX_ERROR",
            "40001, TRANSACTION_ROLLBACK",
            "40P01, TRANSACTION_ROLLBACK",
            "55P03, LOCK_TIMEOUT",
            "55000, OBJECT_STATE_ERROR",
            "53100, INSUFFICIENT_RESOURCES",
            "57014, TIMEOUT_ERROR",
            "XX000, DATABASE_ERROR"
    })
    @DisplayName("Should categorize SQL exceptions by SQL state")
    void testCategorize_BySqlState(String sqlState, ErrorCategory expected) {
        assertEquals(expected, ErrorCategory.categorize(new SQLException("failure", sqlState)));
    }

    @Test
    @DisplayName("Should categorize SQL errors by message when SQL state unavailable")
    void testCategorize_SqlErrorByMessage() {
        assertEquals(ErrorCategory.CONNECTION_ERROR,
                ErrorCategory.categorize(new SQLException("Connection timeout occurred")));
        assertEquals(ErrorCategory.PERMISSION_ERROR,
                ErrorCategory.categorize(new SQLException("must be owner of hypertable fixes")));
        assertEquals(ErrorCategory.SQL_SYNTAX_ERROR,
                ErrorCategory.categorize(new SQLException("relation \"fixes\" does not exist")));
        assertEquals(ErrorCategory.OBJECT_STATE_ERROR,
                ErrorCategory.categorize(new SQLException("chunk \"_hyper_1_1_chunk\" is not compressed")));
    }

    @Test
    @DisplayName("Should categorize a wrapped SQL exception by its SQL state")
    void testCategorize_WrappedSqlException() {
        SQLException cause = new SQLException("lock not available", "55P03");
        SqlExecutionException ex = new SqlExecutionException(0, "55P03", "lock not available", cause);

        assertEquals(ErrorCategory.LOCK_TIMEOUT, ErrorCategory.categorize(ex));
        assertEquals(ErrorCategory.LOCK_TIMEOUT, ex.category());
    }

    // ============================================================================
    // Non-SQL Categorization Tests
    // ============================================================================

    @Test
    @DisplayName("Should categorize network exceptions as network error")
    void testCategorize_Network() {
        assertEquals(ErrorCategory.NETWORK_ERROR, ErrorCategory.categorize(new SocketTimeoutException("timed out")));
        assertEquals(ErrorCategory.NETWORK_ERROR, ErrorCategory.categorize(new ConnectException("Connection refused")));
    }

    @Test
    @DisplayName("Should categorize timeouts as timeout error")
    void testCategorize_Timeout() {
        assertEquals(ErrorCategory.TIMEOUT_ERROR, ErrorCategory.categorize(new TimeoutException("Operation timed out")));
        assertEquals(ErrorCategory.TIMEOUT_ERROR, ErrorCategory.categorize(new RuntimeException("Request timeout exceeded")));
    }

    @Test
    @DisplayName("Should categorize argument and state errors as validation error")
    void testCategorize_Validation() {
        assertEquals(ErrorCategory.VALIDATION_ERROR, ErrorCategory.categorize(new IllegalArgumentException("bad")));
        assertEquals(ErrorCategory.VALIDATION_ERROR, ErrorCategory.categorize(new IllegalStateException("bad")));
    }

    // ============================================================================
    // Null and Unknown Error Tests
    // ============================================================================

    @Test
    @DisplayName("Should return UNKNOWN for null exception")
    void testCategorize_Null() {
        assertEquals(ErrorCategory.UNKNOWN, ErrorCategory.categorize(null));
    }

    @Test
    @DisplayName("Should return APPLICATION_ERROR for unclassified exceptions")
    void testCategorize_UnclassifiedException() {
        assertEquals(ErrorCategory.APPLICATION_ERROR, ErrorCategory.categorize(new RuntimeException("Generic error")));
    }

    @Test
    @DisplayName("Should return correct string representation")
    void testToString() {
        assertEquals("CONNECTION_ERROR", ErrorCategory.CONNECTION_ERROR.toString());
    }

    @ParameterizedTest
    @MethodSource("provideErrorCategories")
    @DisplayName("Should have non-empty name and description for all categories")
    void testAllCategoriesHaveNameAndDescription(ErrorCategory category) {
        assertFalse(category.getName().isEmpty());
        assertFalse(category.getDescription().isEmpty());
    }

    static Stream<Arguments> provideErrorCategories() {
        return Stream.of(ErrorCategory.values()).map(Arguments::of);
    }
}
