package com.vedant.salesanalyst.service;

import com.vedant.salesanalyst.exception.AnalystException;
import com.vedant.salesanalyst.exception.GenerationBlockedException;
import com.vedant.salesanalyst.exception.SqlValidationException;
import com.vedant.salesanalyst.model.ErrorKind;
import com.vedant.salesanalyst.model.GoldenExample;
import com.vedant.salesanalyst.model.QueryRows;
import com.vedant.salesanalyst.model.RetrievalResult;
import com.vedant.salesanalyst.model.SynthesisResult;
import com.vedant.salesanalyst.model.WorkflowState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Runs one question through retrieval, example selection, SQL synthesis, execution and
 * narration, recording each stage in a fresh {@link WorkflowState}.
 *
 * <p>Never throws for pipeline failures: the returned state carries the error, the generic
 * friendly message and whatever the earlier stages produced.</p>
 */
@Service
public class AnalysisWorkflow {

    private static final Logger log = LoggerFactory.getLogger(AnalysisWorkflow.class);

    public static final String FRIENDLY_ERROR = "Sorry, I couldn't answer that question. Please try rephrasing it.";

    private final ContextRetriever retriever;
    private final ExampleSelector exampleSelector;
    private final SqlSynthesizer synthesizer;
    private final ResultNarrator narrator;
    private final SchemaIndexer schemaIndexer;

    public AnalysisWorkflow(ContextRetriever retriever,
                            ExampleSelector exampleSelector,
                            SqlSynthesizer synthesizer,
                            ResultNarrator narrator,
                            SchemaIndexer schemaIndexer) {
        this.retriever = retriever;
        this.exampleSelector = exampleSelector;
        this.synthesizer = synthesizer;
        this.narrator = narrator;
        this.schemaIndexer = schemaIndexer;
    }

    /** Runs against the currently indexed schema. */
    public WorkflowState execute(String question, QueryRunner runner) {
        return execute(question, schemaIndexer.activeSchema(), runner);
    }

    /**
     * @param runner executes the accepted statement; {@code null} stops after generation
     */
    public WorkflowState execute(String question, String schema, QueryRunner runner) {
        WorkflowState state = new WorkflowState(question);
        state.setSchema(schema);
        log.info("=== WORKFLOW START === schema={} question='{}'", schema, question);

        /* ---------------- retrieve_context ---------------- */
        RetrievalResult context;
        try {
            context = retriever.retrieve(question, schema);
        } catch (AnalystException e) {
            return handleError(state, e.getKind(), "retrieve_context_error", e);
        } catch (RuntimeException e) {
            return handleError(state, ErrorKind.RETRIEVAL, "retrieve_context_error", e);
        }
        state.setRelevantContext(context.documents());
        state.setRetrievedTables(context.retrievedTables());
        state.markStep("retrieve_context");

        /* ---------------- select_examples ---------------- */
        List<GoldenExample> examples;
        try {
            examples = exampleSelector.select(question, schema);
        } catch (RuntimeException e) {
            // few-shot grounding is optional
            log.warn("Example selection failed, continuing without examples: {}", e.getMessage());
            examples = List.of();
        }
        state.setExamples(examples);
        state.markStep("select_examples");

        /* ---------------- generate_sql ---------------- */
        SynthesisResult synthesis;
        try {
            synthesis = synthesizer.synthesize(question, schema, context, examples);
        } catch (GenerationBlockedException e) {
            state.setGeneratedSql(e.getSql());
            state.setGenerationAttempts(1);
            return handleError(state, e.getKind(), "generate_sql_blocked", e);
        } catch (SqlValidationException e) {
            state.setGeneratedSql(e.getSql());
            state.setGenerationAttempts(SqlSynthesizer.MAX_ATTEMPTS);
            state.setSqlValidationErrors(e.getErrors());
            return handleError(state, e.getKind(), "generate_sql_error", e);
        } catch (AnalystException e) {
            return handleError(state, e.getKind(), "generate_sql_error", e);
        } catch (RuntimeException e) {
            return handleError(state, ErrorKind.GENERATION, "generate_sql_error", e);
        }
        state.setGeneratedSql(synthesis.sql());
        state.setGenerationAttempts(synthesis.attempts());
        state.setSqlValidationErrors(synthesis.notes());
        state.markStep("generate_sql");

        if (runner == null) {
            log.info("No query runner supplied, stopping after SQL generation");
            return state;
        }

        /* ---------------- execute_sql ---------------- */
        QueryRows rows;
        long start = System.nanoTime();
        try {
            rows = runner.runQueryWithColumns(synthesis.sql());
        } catch (AnalystException e) {
            state.setExecutionTime((System.nanoTime() - start) / 1_000_000_000.0);
            return handleError(state, e.getKind(), "execute_sql_error", e);
        } catch (RuntimeException e) {
            state.setExecutionTime((System.nanoTime() - start) / 1_000_000_000.0);
            return handleError(state, ErrorKind.EXECUTION, "execute_sql_error", e);
        }
        state.setExecutionTime((System.nanoTime() - start) / 1_000_000_000.0);
        if (rows == null) {
            rows = QueryRows.empty();
        }
        state.setQueryResults(rows.rows());
        state.setColumnNames(rows.columnNames());
        state.markStep("execute_sql");

        /* ---------------- analyze_results ---------------- */
        try {
            state.setAnalysis(narrator.narrate(question, synthesis.sql(), rows.rows(), rows.columnNames()));
        } catch (AnalystException e) {
            // rows stay in the state
            return handleError(state, e.getKind(), "analyze_results_error", e);
        } catch (RuntimeException e) {
            return handleError(state, ErrorKind.NARRATION, "analyze_results_error", e);
        }
        state.markStep("analyze_results");

        log.info("=== WORKFLOW DONE === steps={} rows={} time={}s",
                state.getStepsCompleted(), rows.size(), state.getExecutionTime());
        return state;
    }

    /* ---------------- handle_error ---------------- */
    private WorkflowState handleError(WorkflowState state, ErrorKind kind, String step, Exception e) {
        log.error("Workflow failed at {}: {}", step, e.getMessage(), e);
        state.fail(kind, step, e.getMessage() != null ? e.getMessage() : e.toString());
        state.setFriendlyError(FRIENDLY_ERROR);
        state.markStep("handle_error");
        return state;
    }
}
