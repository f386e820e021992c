/*
 * Copyright 2014-2016 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Amazon Software License (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *  http://aws.amazon.com/asl/
 *
 * or in the "license" file accompanying this file.
 * This file is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and limitations under the License.
 */
package com.amazon.console.redirect.redirection;

import java.io.PrintStream;

import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

/**
 * {@code System.out} and {@code System.err} as {@link IOutputTarget}s. Both
 * share one lock, so a swap on either never interleaves with another swap.
 */
@ThreadSafe
public final class SystemOutputTarget implements IOutputTarget {
    private static final Object LOCK = new Object();

    public static final SystemOutputTarget STDOUT = new SystemOutputTarget("stdout", false);
    public static final SystemOutputTarget STDERR = new SystemOutputTarget("stderr", true);

    private final String name;
    private final boolean error;

    private SystemOutputTarget(String name, boolean error) {
        this.name = name;
        this.error = error;
    }

    @Override
    @Nullable
    public PrintStream get() {
        synchronized (LOCK) {
            return error ? System.err : System.out;
        }
    }

    @Override
    @Nullable
    public PrintStream swap(@Nullable PrintStream replacement) {
        synchronized (LOCK) {
            PrintStream previous;
            if (error) {
                previous = System.err;
                System.setErr(replacement);
            } else {
                previous = System.out;
                System.setOut(replacement);
            }
            return previous;
        }
    }

    @Override
    public String toString() {
        return name;
    }
}
