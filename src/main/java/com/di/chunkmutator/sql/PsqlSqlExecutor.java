package com.di.chunkmutator.sql;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * {@link SqlExecutor} that shells out to {@code psql}, one process per statement.
 *
 * <p>Queries run with {@code -tAc} (tuples only, unaligned, {@code |}-separated);
 * mutations run with {@code -c} so psql prints the command tag. A non-zero
 * exit status becomes a {@link SqlExecutionException} carrying that status and
 * the captured standard error.
 */
@Slf4j
public class PsqlSqlExecutor implements SqlExecutor {

    static final String FIELD_SEPARATOR = "|";

    private final String psqlBinary;
    private final String database;

    public PsqlSqlExecutor(String psqlBinary, String database) {
        this.psqlBinary = psqlBinary;
        this.database   = database;
    }

    @Override
    public String queryForText(String sql) {
        return run(List.of("-tAc", sql)).trim();
    }

    @Override
    public List<Map<String, String>> queryForRows(String sql, List<String> columns) {
        return parseUnaligned(run(List.of("-tAc", sql)), columns);
    }

    @Override
    public MutationOutcome execute(String sql) {
        String stdout = run(List.of("-c", sql));
        MutationOutcome outcome = new MutationOutcome(lastNonBlankLine(stdout));
        log.debug("[SQL] psql {} -> {}", database, outcome.commandTag());
        return outcome;
    }

    @Override
    public String describe() {
        return "psql:" + database;
    }

    /**
     * Splits unaligned psql output into rows. Lines whose field count does not
     * match {@code columns} are skipped.
     */
    static List<Map<String, String>> parseUnaligned(String output, List<String> columns) {
        List<Map<String, String>> rows = new ArrayList<>();
        if (output == null || output.isBlank()) {
            return rows;
        }
        for (String line : output.strip().split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            String[] parts = line.split("\\" + FIELD_SEPARATOR, -1);
            if (parts.length != columns.size()) {
                log.debug("[SQL] skipping line with {} field(s), expected {}: {}", parts.length, columns.size(), line);
                continue;
            }
            Map<String, String> row = new LinkedHashMap<>();
            for (int i = 0; i < parts.length; i++) {
                row.put(columns.get(i), parts[i].trim());
            }
            rows.add(row);
        }
        return rows;
    }

    static String lastNonBlankLine(String output) {
        if (output == null) {
            return "";
        }
        String[] lines = output.strip().split("\n");
        for (int i = lines.length - 1; i >= 0; i--) {
            if (!lines[i].isBlank()) {
                return lines[i].trim();
            }
        }
        return "";
    }

    List<String> command(List<String> args) {
        List<String> cmd = new ArrayList<>();
        cmd.add(psqlBinary);
        cmd.add("-X");
        cmd.add("-v");
        cmd.add("ON_ERROR_STOP=1");
        cmd.add("-d");
        cmd.add(database);
        cmd.addAll(args);
        return cmd;
    }

    private String run(List<String> args) {
        Process process;
        try {
            process = new ProcessBuilder(command(args)).start();
        } catch (IOException e) {
            throw new SqlExecutionException(-1, null, "cannot start " + psqlBinary + ": " + e.getMessage(), e);
        }
        // stderr is drained on a separate thread so a chatty server cannot fill the pipe and block stdout
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readFully(process.getErrorStream()));
        String stdout = readFully(process.getInputStream());
        int exit;
        String errText;
        try {
            exit    = process.waitFor();
            errText = stderr.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroy();
            throw new SqlExecutionException(-1, null, "interrupted waiting for psql", e);
        } catch (ExecutionException e) {
            throw new SqlExecutionException(-1, null, "failed reading psql stderr", e.getCause());
        }
        if (exit != 0) {
            throw new SqlExecutionException(exit, errText.strip());
        }
        return stdout;
    }

    private static String readFully(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SqlExecutionException(-1, null, "failed reading psql output: " + e.getMessage(), e);
        }
    }
}
