package com.vedant.salesanalyst.dto;

import com.vedant.salesanalyst.model.SchemaDocument;
import com.vedant.salesanalyst.model.WorkflowState;

import java.util.List;

public class NLQueryResponseDTO {
    private String question;
    private String schema;
    private String sql;
    private List<String> columns;
    private List<List<Object>> rows;
    private String analysis;
    private List<String> retrievedTables;
    private List<String> context;
    private List<String> stepsCompleted;
    private List<String> validationErrors;
    private Integer generationAttempts;
    private Double executionTime;
    private String error;
    private String message;

    public NLQueryResponseDTO() {}

    public static NLQueryResponseDTO from(WorkflowState state) {
        NLQueryResponseDTO dto = new NLQueryResponseDTO();
        dto.setQuestion(state.getQuery());
        dto.setSchema(state.getSchema());
        dto.setSql(state.getGeneratedSql());
        dto.setColumns(state.getColumnNames());
        dto.setRows(state.getQueryResults());
        dto.setAnalysis(state.getAnalysis());
        dto.setRetrievedTables(state.getRetrievedTables());
        dto.setContext(state.getRelevantContext().stream().map(SchemaDocument::getText).toList());
        dto.setStepsCompleted(state.getStepsCompleted());
        dto.setValidationErrors(state.getSqlValidationErrors());
        dto.setGenerationAttempts(state.getGenerationAttempts());
        dto.setExecutionTime(state.getExecutionTime());
        dto.setError(state.getError());
        dto.setMessage(state.hasError() ? state.getFriendlyError() : "OK");
        return dto;
    }

    public String getQuestion() { return question; }
    public void setQuestion(String question) { this.question = question; }

    public String getSchema() { return schema; }
    public void setSchema(String schema) { this.schema = schema; }

    public String getSql() { return sql; }
    public void setSql(String sql) { this.sql = sql; }

    public List<String> getColumns() { return columns; }
    public void setColumns(List<String> columns) { this.columns = columns; }

    public List<List<Object>> getRows() { return rows; }
    public void setRows(List<List<Object>> rows) { this.rows = rows; }

    public String getAnalysis() { return analysis; }
    public void setAnalysis(String analysis) { this.analysis = analysis; }

    public List<String> getRetrievedTables() { return retrievedTables; }
    public void setRetrievedTables(List<String> retrievedTables) { this.retrievedTables = retrievedTables; }

    public List<String> getContext() { return context; }
    public void setContext(List<String> context) { this.context = context; }

    public List<String> getStepsCompleted() { return stepsCompleted; }
    public void setStepsCompleted(List<String> stepsCompleted) { this.stepsCompleted = stepsCompleted; }

    public List<String> getValidationErrors() { return validationErrors; }
    public void setValidationErrors(List<String> validationErrors) { this.validationErrors = validationErrors; }

    public Integer getGenerationAttempts() { return generationAttempts; }
    public void setGenerationAttempts(Integer generationAttempts) { this.generationAttempts = generationAttempts; }

    public Double getExecutionTime() { return executionTime; }
    public void setExecutionTime(Double executionTime) { this.executionTime = executionTime; }

    public String getError() { return error; }
    public void setError(String error) { this.error = error; }

    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }
}
