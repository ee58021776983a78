package com.vedant.salesanalyst.model;

public enum DocumentKind {
    TABLE,
    OVERVIEW
}
