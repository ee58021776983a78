package com.vedant.salesanalyst.dto;

public class NLQueryRequestDTO {
    private String nlQuery;

    public NLQueryRequestDTO() {}

    public NLQueryRequestDTO(String nlQuery) {
        this.nlQuery = nlQuery;
    }

    public String getNlQuery() { return nlQuery; }
    public void setNlQuery(String nlQuery) { this.nlQuery = nlQuery; }
}
