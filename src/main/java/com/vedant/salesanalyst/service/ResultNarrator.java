package com.vedant.salesanalyst.service;

import com.vedant.salesanalyst.exception.LlmException;
import com.vedant.salesanalyst.exception.NarrationException;
import com.vedant.salesanalyst.llm.LanguageModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns result rows into a short written analysis, and SQL into a plain-English explanation.
 */
@Service
public class ResultNarrator {

    private static final Logger log = LoggerFactory.getLogger(ResultNarrator.class);

    public static final String NO_RESULTS = "No results found for this query.";

    static final int MAX_ROWS = 20;

    private final LanguageModel languageModel;

    public ResultNarrator(LanguageModel languageModel) {
        this.languageModel = languageModel;
    }

    /**
     * Zero rows short-circuit to {@link #NO_RESULTS} without a model call.
     *
     * @throws NarrationException when the model call fails
     */
    public String narrate(String question, String sql, List<List<Object>> rows, List<String> columnNames) {
        if (rows == null || rows.isEmpty()) {
            return NO_RESULTS;
        }

        String prompt = "You are a careful sales data analyst. Use ONLY the rows below. "
                + "Do NOT invent rows, columns or values. Do NOT ask the user questions.\n\n"
                + "Question: " + question + "\n\n"
                + "SQL:\n" + sql + "\n\n"
                + "Results (" + rows.size() + " rows):\n" + renderRows(rows, columnNames) + "\n"
                + "Write the analysis in exactly this structure:\n"
                + "1. A one-sentence direct answer to the question.\n"
                + "2. Key findings: 3-5 bullet points using concrete numbers from the rows.\n"
                + "3. Notable trends or outliers, if any.\n";

        log.info("=== SUMMARY PROMPT TO LLM ===\n{}", prompt);
        try {
            return languageModel.complete(prompt, 0.3, 1000);
        } catch (LlmException e) {
            throw new NarrationException("Result analysis failed: " + e.getMessage(), e);
        }
    }

    /** Explains a statement in 3-5 plain-English bullets. */
    public String explain(String sql) {
        if (sql == null || sql.isBlank()) {
            throw new IllegalArgumentException("SQL must not be empty");
        }
        String prompt = "Explain what the following SQL query does in plain English for a business user.\n"
                + "Use 3-5 short bullet points. Mention the tables involved, the filters, and what each result "
                + "column means. Do NOT rewrite the query.\n\n"
                + "SQL:\n" + sql;
        try {
            return languageModel.complete(prompt, 0.3, 500);
        } catch (LlmException e) {
            throw new NarrationException("SQL explanation failed: " + e.getMessage(), e);
        }
    }

    /** Column header line, then the first {@value #MAX_ROWS} rows, then a count of the rest. */
    static String renderRows(List<List<Object>> rows, List<String> columnNames) {
        StringBuilder sb = new StringBuilder();
        if (columnNames != null && !columnNames.isEmpty()) {
            sb.append(String.join(" | ", columnNames)).append("\n");
        }
        int limit = Math.min(rows.size(), MAX_ROWS);
        for (int i = 0; i < limit; i++) {
            List<String> cells = new ArrayList<>();
            for (Object v : rows.get(i)) {
                cells.add(String.valueOf(v));
            }
            sb.append(String.join(" | ", cells)).append("\n");
        }
        if (rows.size() > MAX_ROWS) {
            sb.append("... and ").append(rows.size() - MAX_ROWS).append(" more rows\n");
        }
        return sb.toString();
    }
}
