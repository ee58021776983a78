package com.vedant.salesanalyst.model;

import java.util.List;

/**
 * An accepted statement.
 *
 * @param sql      cleaned, validated statement
 * @param attempts number of drafts it took, 1 or 2
 * @param notes    non-fatal findings of the last attempt
 */
public record SynthesisResult(String sql, int attempts, List<String> notes) {}
