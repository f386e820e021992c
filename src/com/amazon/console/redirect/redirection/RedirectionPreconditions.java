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

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;

import javax.annotation.Nullable;

import org.apache.commons.lang3.StringUtils;

import com.google.common.base.Preconditions;

/**
 * Argument checks shared by the redirection API. All of them fail with
 * {@link IllegalArgumentException} before any file system access.
 */
final class RedirectionPreconditions {
    private RedirectionPreconditions() {
    }

    static Path checkPath(@Nullable String path) {
        Preconditions.checkArgument(!StringUtils.isBlank(path), "File path cannot be null or empty.");
        try {
            return checkPath(Paths.get(path));
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("File path contains illegal characters: " + e.getMessage(), e);
        }
    }

    static Path checkPath(@Nullable Path path) {
        Preconditions.checkArgument(path != null && !StringUtils.isBlank(path.toString()),
                "File path cannot be null or empty.");
        Preconditions.checkArgument(path.getFileName() != null, "File path does not name a file: %s", path);
        return path;
    }

    static void checkLimits(long maxSizeBytes, int maxFiles) {
        Preconditions.checkArgument(maxSizeBytes > 0, "Max size must be greater than zero: %s", maxSizeBytes);
        Preconditions.checkArgument(maxFiles > 0, "Max files must be greater than zero: %s", maxFiles);
    }
}
