/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.eval.calc;

import java.util.List;
import java.util.Objects;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;

/**
 * Splits a postfix expression into tokens.
 */
public final class Tokenizer {
    private Tokenizer() {}

    private static final Splitter SPLITTER =
        Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

    /**
     * Splits the given expression on runs of whitespace. Leading and trailing
     * whitespace produce no tokens.
     *
     * @param expression the expression to split
     * @return an immutable list of tokens
     */
    public static List<String> tokenize(String expression) {
        return SPLITTER.splitToList(Objects.requireNonNull(expression));
    }
}
