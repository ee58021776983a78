package com.vedant.salesanalyst.service;

import com.vedant.salesanalyst.entity.QueryHistory;
import com.vedant.salesanalyst.model.WorkflowState;
import com.vedant.salesanalyst.repository.QueryHistoryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class QueryServiceTest {

    private AnalysisWorkflow workflow;
    private SqlExecutor executor;
    private QueryHistoryRepository repo;
    private QueryService svc;

    @BeforeEach
    void setUp() {
        workflow = mock(AnalysisWorkflow.class);
        executor = mock(SqlExecutor.class);
        repo = mock(QueryHistoryRepository.class);
        SchemaIndexer indexer = mock(SchemaIndexer.class);
        when(indexer.activeSchema()).thenReturn("northwind");
        when(repo.save(any(QueryHistory.class))).thenAnswer(inv -> {
            QueryHistory h = inv.getArgument(0);
            h.setId(7L);
            return h;
        });
        svc = new QueryService(workflow, mock(ResultNarrator.class), executor, indexer, repo);
    }

    @Test
    void asksAgainstTheActiveSchema() {
        WorkflowState state = new WorkflowState("How many customers?");
        when(workflow.execute("How many customers?", "northwind", executor)).thenReturn(state);

        assertSame(state, svc.ask("  How many customers?  "));
    }

    @Test
    void rejectsBlankQuestion() {
        assertThrows(IllegalArgumentException.class, () -> svc.ask("   "));
        verifyNoInteractions(workflow);
    }

    @Test
    void savesAtMostOneHundredRows() {
        List<List<Object>> rows = new ArrayList<>();
        for (int i = 0; i < 150; i++) {
            rows.add(List.of(i, "c" + i));
        }

        Long id = svc.save("all customers", "SELECT * FROM northwind.customers", List.of("n", "name"), rows, "Many.");

        ArgumentCaptor<QueryHistory> saved = ArgumentCaptor.forClass(QueryHistory.class);
        verify(repo).save(saved.capture());
        assertEquals(7L, id);
        assertEquals("northwind", saved.getValue().getSchemaName());
        assertEquals(150, saved.getValue().getRowCount());
        assertTrue(saved.getValue().getResultsJson().contains("\"c99\""));
        assertFalse(saved.getValue().getResultsJson().contains("\"c100\""));
    }

    @Test
    void trimsOversizedResultsToTwentyRows() {
        String wide = "x".repeat(1000);
        List<List<Object>> rows = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            rows.add(List.of(i, wide));
        }

        String json = svc.resultsJson(List.of("n", "text"), rows);

        assertTrue(json.length() <= QueryService.MAX_RESULTS_JSON);
        assertTrue(json.contains("[19,"));
        assertFalse(json.contains("[20,"));
    }

    @Test
    void exportsSavedResultsAsCsv() {
        QueryHistory h = new QueryHistory();
        h.setResultsJson(svc.resultsJson(List.of("country", "customers"),
                List.of(List.of("Germany", 11), List.of("USA", 13))));
        when(repo.findById(3L)).thenReturn(Optional.of(h));

        String csv = svc.exportCsv(3L).orElseThrow();

        assertEquals("\"country\",\"customers\"\n\"Germany\",\"11\"\n\"USA\",\"13\"\n", csv);
    }

    @Test
    void exportOfUnknownQueryIsEmpty() {
        when(repo.findById(99L)).thenReturn(Optional.empty());

        assertTrue(svc.exportCsv(99L).isEmpty());
    }

    @Test
    void deleteReportsMissingQuery() {
        when(repo.existsById(5L)).thenReturn(false);

        assertFalse(svc.delete(5L));
        verify(repo, never()).deleteById(anyLong());
    }
}
