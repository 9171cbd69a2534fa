/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.eval.calc;

import java.util.Objects;

/**
 * Thrown by a calculator step that cannot complete. The exception unwinds
 * the running state program and is turned back into its {@link EvalError}
 * by the {@link Calculator}.
 */
public class EvalException extends RuntimeException {
    private static final long serialVersionUID = -2310466370185624573L;

    private final EvalError error;

    public EvalException(EvalError error) {
        super(error.getMessage());
        this.error = Objects.requireNonNull(error);
    }

    public EvalError getError() {
        return error;
    }
}
