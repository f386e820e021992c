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

import java.nio.file.Path;

import org.joda.time.DateTime;
import org.joda.time.format.DateTimeFormat;

import com.amazon.console.redirect.Constants;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

/**
 * Computes the names of timestamped and rotated files. Nothing here touches
 * the file system: directories are neither created nor checked.
 *
 * For a base path {@code logs/app.log}:
 * <ul>
 *   <li>timestamped: {@code logs/app-20250726-143052.log}</li>
 *   <li>rotated backup 2: {@code logs/app.2.log}</li>
 * </ul>
 */
public final class PathNamer {
    private PathNamer() {
    }

    /**
     * @see #timestamped(Path, String, DateTime)
     */
    public static Path timestamped(Path basePath) {
        return timestamped(basePath, Constants.DEFAULT_TIMESTAMP_FORMAT);
    }

    /**
     * @see #timestamped(Path, String, DateTime)
     */
    public static Path timestamped(Path basePath, String format) {
        return timestamped(basePath, format, DateTime.now());
    }

    /**
     * @param basePath the file to derive the name from.
     * @param format a Joda-Time pattern, e.g. {@code yyyyMMdd-HHmmss}.
     * @param time the instant to render.
     * @return {@code stem-timestamp.ext} in the directory of {@code basePath}.
     * @throws IllegalArgumentException if the path is blank or the format is
     *         empty or not a valid pattern.
     */
    public static Path timestamped(Path basePath, String format, DateTime time) {
        RedirectionPreconditions.checkPath(basePath);
        Preconditions.checkArgument(!Strings.isNullOrEmpty(format), "Timestamp format cannot be empty.");
        Preconditions.checkNotNull(time);
        String timestamp = DateTimeFormat.forPattern(format).print(time);
        return basePath.resolveSibling(stem(basePath) + "-" + timestamp + extension(basePath));
    }

    /**
     * @return {@code stem.index.ext} in the directory of {@code basePath}.
     */
    public static Path rotatedName(Path basePath, int index) {
        RedirectionPreconditions.checkPath(basePath);
        Preconditions.checkArgument(index >= 1, "Rotation index must be at least 1: %s", index);
        return basePath.resolveSibling(stem(basePath) + "." + index + extension(basePath));
    }

    /**
     * @return the file name without its extension. A leading dot does not
     *         start an extension, so the stem of {@code .profile} is
     *         {@code .profile}.
     */
    public static String stem(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    /**
     * @return the extension including its dot, or an empty string.
     */
    public static String extension(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot) : "";
    }
}
