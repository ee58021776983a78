package com.vedant.salesanalyst.llm;

/** Single-turn text completion. */
public interface LanguageModel {

    String complete(String prompt, double temperature, int maxTokens);
}
