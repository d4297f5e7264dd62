package com.ippcode.analyzer.model;

/**
 * A whitespace-delimited slice of a source line.
 */
public record Token(String text, int line) {
}
