package com.vedant.salesanalyst.dto;

public class UploadResponseDTO {
    private String schema;
    private Integer tableCount;
    private Integer columnCount;
    private Integer relationshipCount;
    private Integer queryCount;
    private String message;

    public UploadResponseDTO() {}

    public UploadResponseDTO(String schema, Integer tableCount, Integer columnCount,
                             Integer relationshipCount, Integer queryCount, String message) {
        this.schema = schema;
        this.tableCount = tableCount;
        this.columnCount = columnCount;
        this.relationshipCount = relationshipCount;
        this.queryCount = queryCount;
        this.message = message;
    }

    public String getSchema() { return schema; }
    public void setSchema(String schema) { this.schema = schema; }

    public Integer getTableCount() { return tableCount; }
    public void setTableCount(Integer tableCount) { this.tableCount = tableCount; }

    public Integer getColumnCount() { return columnCount; }
    public void setColumnCount(Integer columnCount) { this.columnCount = columnCount; }

    public Integer getRelationshipCount() { return relationshipCount; }
    public void setRelationshipCount(Integer relationshipCount) { this.relationshipCount = relationshipCount; }

    public Integer getQueryCount() { return queryCount; }
    public void setQueryCount(Integer queryCount) { this.queryCount = queryCount; }

    public String getMessage() { return message; }
    public void setMessage(String message) { this.message = message; }
}
