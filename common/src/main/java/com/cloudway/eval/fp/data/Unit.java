/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.eval.fp.data;

/**
 * The unit type which has only one value. Used as the result of state
 * programs that only update the state.
 */
public enum Unit {
    /**
     * The only value of the unit type.
     */
    U;

    @Override
    public String toString() {
        return "()";
    }
}
