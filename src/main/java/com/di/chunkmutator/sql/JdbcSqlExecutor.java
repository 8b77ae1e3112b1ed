package com.di.chunkmutator.sql;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.StatementCallback;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link SqlExecutor} backed by a Spring {@link JdbcTemplate}.
 *
 * <p>Each call borrows one pooled connection for the duration of the statement,
 * so the pool size bounds how many segment pipelines can talk to the database
 * at once. The pool must run in auto-commit mode: there is no transaction
 * manager around these calls.
 */
@Slf4j
public class JdbcSqlExecutor implements SqlExecutor {

    private final JdbcTemplate jdbc;
    private final String       label;

    public JdbcSqlExecutor(JdbcTemplate jdbc, String label) {
        this.jdbc  = jdbc;
        this.label = label;
    }

    @Override
    public String queryForText(String sql) {
        try {
            List<String> values = jdbc.query(sql, (rs, n) -> rs.getString(1));
            if (values.isEmpty() || values.get(0) == null) {
                return "";
            }
            return values.get(0).trim();
        } catch (DataAccessException ex) {
            throw translate(ex);
        }
    }

    @Override
    public List<Map<String, String>> queryForRows(String sql, List<String> columns) {
        try {
            return jdbc.query(sql, (rs, n) -> {
                Map<String, String> row = new LinkedHashMap<>();
                for (int i = 0; i < columns.size(); i++) {
                    String v = rs.getString(i + 1);
                    row.put(columns.get(i), v == null ? null : v.trim());
                }
                return row;
            });
        } catch (DataAccessException ex) {
            throw translate(ex);
        }
    }

    @Override
    public MutationOutcome execute(String sql) {
        String verb = RowCountParser.leadingVerb(sql);
        try {
            Long rows = jdbc.execute((StatementCallback<Long>) stmt -> {
                boolean hasResultSet = stmt.execute(sql);
                long last = 0L;
                while (true) {
                    if (!hasResultSet) {
                        int count = stmt.getUpdateCount();
                        if (count == -1) {
                            break;
                        }
                        last = count;
                    }
                    hasResultSet = stmt.getMoreResults();
                }
                return last;
            });
            MutationOutcome outcome = MutationOutcome.of(verb, rows == null ? 0L : rows);
            log.debug("[SQL] {} -> {}", label, outcome.commandTag());
            return outcome;
        } catch (DataAccessException ex) {
            throw translate(ex);
        }
    }

    @Override
    public String describe() {
        return "jdbc:" + label;
    }

    private SqlExecutionException translate(DataAccessException ex) {
        for (Throwable t = ex; t != null; t = t.getCause()) {
            if (t instanceof SQLException sqlEx) {
                return new SqlExecutionException(sqlEx.getErrorCode(), sqlEx.getSQLState(), sqlEx.getMessage(), sqlEx);
            }
        }
        return new SqlExecutionException(-1, null, ex.getMostSpecificCause().getMessage(), ex);
    }
}
