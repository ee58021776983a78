package com.vedant.salesanalyst.dto;

import java.util.List;

public class SaveQueryRequestDTO {
    private String question;
    private String sql;
    private List<String> columns;
    private List<List<Object>> rows;
    private String analysis;

    public SaveQueryRequestDTO() {}

    public String getQuestion() { return question; }
    public void setQuestion(String question) { this.question = question; }

    public String getSql() { return sql; }
    public void setSql(String sql) { this.sql = sql; }

    public List<String> getColumns() { return columns; }
    public void setColumns(List<String> columns) { this.columns = columns; }

    public List<List<Object>> getRows() { return rows; }
    public void setRows(List<List<Object>> rows) { this.rows = rows; }

    public String getAnalysis() { return analysis; }
    public void setAnalysis(String analysis) { this.analysis = analysis; }
}
