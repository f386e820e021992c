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

/**
 * A replaceable, process-wide output stream such as {@code System.out}.
 */
public interface IOutputTarget {
    /**
     * @return the stream currently installed, which may be {@code null}.
     */
    @Nullable
    PrintStream get();

    /**
     * Installs {@code replacement} and returns the stream it displaced, as
     * one atomic step with respect to other callers of this target. A
     * {@code null} stream is accepted in both directions, so whatever was
     * displaced can always be put back.
     */
    @Nullable
    PrintStream swap(@Nullable PrintStream replacement);
}
