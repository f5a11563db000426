package io.qcron.parser;

import io.qcron.Span;

/**
 * A whitespace-delimited token of an expression.
 *
 * @param text the token text
 * @param span the location of the token in the expression
 */
public record FieldToken(String text, Span span) {}
