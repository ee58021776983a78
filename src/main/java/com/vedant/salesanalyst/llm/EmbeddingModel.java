package com.vedant.salesanalyst.llm;

/** Fixed-dimension embedding of a text. */
public interface EmbeddingModel {

    float[] embed(String text);
}
