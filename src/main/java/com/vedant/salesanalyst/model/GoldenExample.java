package com.vedant.salesanalyst.model;

/** A curated, known-correct question and SQL pair used only as few-shot grounding. */
public record GoldenExample(String question, String sql) {}
