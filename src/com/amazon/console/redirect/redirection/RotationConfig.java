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

import javax.annotation.concurrent.Immutable;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import com.amazon.console.redirect.Constants;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

/**
 * Size and retention limits for one rotated file set.
 */
@Immutable
@Getter
@ToString
@EqualsAndHashCode
public final class RotationConfig {
    private final Path basePath;
    private final long maxSizeBytes;
    private final int maxFiles;
    private final String timestampFormat;

    public RotationConfig(Path basePath, long maxSizeBytes, int maxFiles) {
        this(basePath, maxSizeBytes, maxFiles, Constants.DEFAULT_TIMESTAMP_FORMAT);
    }

    public RotationConfig(Path basePath, long maxSizeBytes, int maxFiles, String timestampFormat) {
        RedirectionPreconditions.checkPath(basePath);
        RedirectionPreconditions.checkLimits(maxSizeBytes, maxFiles);
        Preconditions.checkArgument(!Strings.isNullOrEmpty(timestampFormat), "Timestamp format cannot be empty.");
        this.basePath = basePath;
        this.maxSizeBytes = maxSizeBytes;
        this.maxFiles = maxFiles;
        this.timestampFormat = timestampFormat;
    }
}
