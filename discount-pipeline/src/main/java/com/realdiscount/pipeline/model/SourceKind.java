package com.realdiscount.pipeline.model;

/**
 * Where a retailer's offers came from in a run. There is no fallback kind:
 * a failed retailer contributes nothing.
 */
public enum SourceKind {
    LIVE("live"),
    ERROR("error");

    private final String code;

    SourceKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static SourceKind fromCode(String code) {
        for (SourceKind kind : values()) {
            if (kind.code.equalsIgnoreCase(code)) return kind;
        }
        throw new IllegalArgumentException("Unknown source kind: " + code);
    }
}
