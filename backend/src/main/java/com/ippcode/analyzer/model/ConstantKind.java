package com.ippcode.analyzer.model;

import java.util.Arrays;
import java.util.Optional;

public enum ConstantKind {
    INT("int"),
    BOOL("bool"),
    STRING("string"),
    NIL("nil"),
    FLOAT("float");

    private final String keyword;

    ConstantKind(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public static Optional<ConstantKind> fromKeyword(String keyword) {
        return Arrays.stream(values())
            .filter(kind -> kind.keyword.equals(keyword))
            .findFirst();
    }
}
