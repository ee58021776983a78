package com.vedant.salesanalyst.entity;

import jakarta.persistence.*;
import java.time.Instant;

@Entity
@Table(name = "query_history")
public class QueryHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name="saved_at", nullable = false)
    private Instant savedAt = Instant.now();

    @Column(name="schema_name", nullable = false)
    private String schemaName;

    @Column(name="question", columnDefinition = "text", nullable = false)
    private String question;

    @Column(name="generated_sql", columnDefinition = "text", nullable = false)
    private String generatedSql;

    @Column(name="row_count")
    private Integer rowCount;

    @Column(name="analysis", columnDefinition = "text")
    private String analysis;

    // {"columns": [...], "rows": [[...], ...]}, capped
    @Column(name="results_json", columnDefinition = "text")
    private String resultsJson;

    public QueryHistory() {}

    // Getters / setters
    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public Instant getSavedAt() { return savedAt; }
    public void setSavedAt(Instant savedAt) { this.savedAt = savedAt; }

    public String getSchemaName() { return schemaName; }
    public void setSchemaName(String schemaName) { this.schemaName = schemaName; }

    public String getQuestion() { return question; }
    public void setQuestion(String question) { this.question = question; }

    public String getGeneratedSql() { return generatedSql; }
    public void setGeneratedSql(String generatedSql) { this.generatedSql = generatedSql; }

    public Integer getRowCount() { return rowCount; }
    public void setRowCount(Integer rowCount) { this.rowCount = rowCount; }

    public String getAnalysis() { return analysis; }
    public void setAnalysis(String analysis) { this.analysis = analysis; }

    public String getResultsJson() { return resultsJson; }
    public void setResultsJson(String resultsJson) { this.resultsJson = resultsJson; }
}
