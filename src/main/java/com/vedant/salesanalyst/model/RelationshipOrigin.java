package com.vedant.salesanalyst.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Provenance of a join edge. Declaration order is merge priority: later origins win.
 */
public enum RelationshipOrigin {
    FK_CONSTRAINT("fk_constraint"),
    COMMENT_FK("comment_fk"),
    YAML("yaml");

    private final String label;

    RelationshipOrigin(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
