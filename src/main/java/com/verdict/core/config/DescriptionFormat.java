package com.verdict.core.config;

import java.util.function.UnaryOperator;

/**
 * How example descriptions are normalised before they are reported.
 */
public enum DescriptionFormat {
    AS_IS(description -> description),
    TRIMMED(String::strip),
    SINGLE_LINE(description -> description.strip().replaceAll("\\s+", " "));

    private final UnaryOperator<String> formatter;

    DescriptionFormat(UnaryOperator<String> formatter) {
        this.formatter = formatter;
    }

    public String apply(String description) {
        return description == null ? null : formatter.apply(description);
    }
}
