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

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Summary of a base file and its contiguous numbered backups.
 */
@Immutable
@Getter
@ToString
@EqualsAndHashCode
public final class RotationInfo {
    public static final RotationInfo EMPTY = new RotationInfo(0, 0, null, null);

    private final int fileCount;
    private final long totalSize;
    /** Highest-numbered backup, or the base file if there are no backups. */
    @Nullable private final Path oldestFile;
    /** The base file if it exists, otherwise the lowest-numbered backup. */
    @Nullable private final Path newestFile;

    public RotationInfo(int fileCount, long totalSize, @Nullable Path oldestFile, @Nullable Path newestFile) {
        this.fileCount = fileCount;
        this.totalSize = totalSize;
        this.oldestFile = oldestFile;
        this.newestFile = newestFile;
    }

    public boolean isEmpty() {
        return fileCount == 0;
    }
}
