package com.vedant.salesanalyst.service;

import com.vedant.salesanalyst.exception.AnalystException;
import com.vedant.salesanalyst.exception.GenerationBlockedException;
import com.vedant.salesanalyst.exception.LlmException;
import com.vedant.salesanalyst.exception.SqlValidationException;
import com.vedant.salesanalyst.llm.LanguageModel;
import com.vedant.salesanalyst.model.ErrorKind;
import com.vedant.salesanalyst.model.GoldenExample;
import com.vedant.salesanalyst.model.RetrievalResult;
import com.vedant.salesanalyst.model.SchemaDocument;
import com.vedant.salesanalyst.model.SynthesisResult;
import com.vedant.salesanalyst.model.ValidationResult;
import com.vedant.salesanalyst.util.SQLValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Drafts SQL with the model and validates it before anything runs.
 *
 * <pre>
 * DRAFTING -> VALIDATING -> ACCEPTED
 *                        -> BLOCKED   (mutating keyword, never retried)
 *                        -> RETRYING -> DRAFTING (corrective prompt)
 *                        -> REJECTED  (errors left after the last attempt)
 * </pre>
 */
@Service
public class SqlSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(SqlSynthesizer.class);

    static final int MAX_ATTEMPTS = 2;
    static final double TEMPERATURE = 0.1;
    static final int MAX_TOKENS = 1000;

    private final LanguageModel languageModel;

    public SqlSynthesizer(LanguageModel languageModel) {
        this.languageModel = languageModel;
    }

    public SynthesisResult synthesize(String question, String schema, RetrievalResult context,
                                      List<GoldenExample> examples) {
        String basePrompt = buildPrompt(question, schema, context.documents(), examples);
        String prompt = basePrompt;
        String sql = null;
        ValidationResult validation = null;

        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            log.info("=== LLM PROMPT SENT (attempt {}) ===\n{}\n========================", attempt, prompt);
            sql = draft(prompt);
            log.info("=== SQL RECEIVED FROM LLM ===\n{}\n=====================", sql);

            Optional<String> blocked = SQLValidator.findBlockedKeyword(sql);
            if (blocked.isPresent()) {
                log.error("Blocked keyword {} in generated SQL", blocked.get());
                throw new GenerationBlockedException(blocked.get(), sql);
            }

            validation = SQLValidator.validateColumns(sql, context.validColumns());
            if (!validation.notes().isEmpty()) {
                log.info("Validation notes: {}", validation.notes());
            }
            if (validation.isValid()) {
                return new SynthesisResult(sql, attempt, validation.notes());
            }

            log.warn("Attempt {} failed validation: {}", attempt, validation.errors());
            prompt = buildRetryPrompt(basePrompt, sql, validation.errors());
        }

        throw new SqlValidationException(sql, validation.errors(), MAX_ATTEMPTS);
    }

    private String draft(String prompt) {
        try {
            return SQLValidator.clean(languageModel.complete(prompt, TEMPERATURE, MAX_TOKENS));
        } catch (LlmException e) {
            throw new AnalystException(ErrorKind.GENERATION, "SQL generation failed: " + e.getMessage(), e);
        }
    }

    /* ============================================================
       PROMPTS
       ============================================================ */
    static String buildPrompt(String question, String schema, List<SchemaDocument> context,
                              List<GoldenExample> examples) {
        StringBuilder sb = new StringBuilder();
        sb.append("You are an expert SQL generator for a sales analytics warehouse.\n");
        sb.append("Generate EXACTLY ONE SQL query that answers the question.\n\n");

        sb.append("STRICT RULES:\n");
        sb.append("1. Only a read-only SELECT (or WITH ... SELECT) statement. No INSERT/UPDATE/DELETE/ALTER/DROP/CREATE.\n");
        sb.append("2. Use ONLY the tables and columns listed in the schema context below. Never invent a column.\n");
        sb.append("3. Always use schema-qualified table names: ").append(schema).append(".tablename\n");
        sb.append("4. Write all identifiers in lowercase.\n");
        sb.append("5. Do not nest aggregate functions (e.g. AVG(SUM(x))); use a subquery or CTE instead.\n");
        sb.append("6. Never emit a USE DATABASE statement.\n");
        sb.append("7. Return ONLY the SQL. No markdown, no ``` fences, no explanations.\n\n");

        sb.append("SCHEMA CONTEXT:\n");
        for (SchemaDocument doc : context) {
            sb.append(doc.getText()).append("\n\n");
        }

        if (examples != null && !examples.isEmpty()) {
            sb.append("EXAMPLES OF CORRECT QUERIES:\n");
            for (GoldenExample ex : examples) {
                sb.append("Question: ").append(ex.question()).append("\n");
                sb.append("SQL: ").append(ex.sql()).append("\n\n");
            }
        }

        sb.append("Question: ").append(question).append("\nSQL:");
        return sb.toString();
    }

    static String buildRetryPrompt(String basePrompt, String previousSql, List<String> errors) {
        StringBuilder sb = new StringBuilder(basePrompt);
        sb.append("\n\nYOUR PREVIOUS ATTEMPT WAS INVALID:\n").append(previousSql).append("\n\n");
        sb.append("Validation errors:\n");
        for (String error : errors) {
            sb.append("- ").append(error).append("\n");
        }
        sb.append("\nFix every error above. Only use columns that are listed in the schema context. ")
                .append("Return ONLY the corrected SQL.\nSQL:");
        return sb.toString();
    }
}
