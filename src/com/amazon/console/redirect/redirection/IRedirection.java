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

import java.io.Closeable;
import java.nio.file.Path;

/**
 * A live redirection of a process-wide output stream into a file. Closing
 * it restores the stream that was installed before it was opened.
 */
public interface IRedirection extends Closeable {
    /**
     * @return the absolute, canonical path of the target file.
     */
    Path getFilePath();

    /**
     * @return {@code true} until the redirection has been released.
     */
    boolean isActive();

    /**
     * Forces buffered output to the file.
     *
     * @throws IllegalStateException if the redirection was already released.
     */
    void flush();

    /**
     * @return the current on-disk size of the file, or 0 if it cannot be read.
     */
    long getFileSize();

    /**
     * Releases the redirection. Calling it more than once has no effect.
     */
    @Override
    void close();
}
