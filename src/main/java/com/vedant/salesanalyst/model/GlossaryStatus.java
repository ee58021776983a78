package com.vedant.salesanalyst.model;

/**
 * How self-describing the indexed schema is.
 *
 * @param status  glossary, cryptic_no_glossary, descriptive or unknown
 * @param message text shown to the user
 * @param type    success, warning or info
 */
public record GlossaryStatus(String status, String message, String type) {

    public static GlossaryStatus unknown() {
        return new GlossaryStatus("unknown", "", "info");
    }
}
