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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import org.slf4j.Logger;

import com.amazon.console.redirect.Logging;
import com.google.common.annotations.VisibleForTesting;

/**
 * Size-based rename rotation. When the base file has reached its size limit,
 * backups are shifted up by one ({@code app.1.log} to {@code app.2.log} and
 * so on), the oldest backup is discarded, and the base file becomes
 * {@code app.1.log}. The caller then opens a fresh base file.
 *
 * Rotation is best effort: failures are logged and never thrown, so a
 * redirection can still be opened on the (possibly oversized) base file.
 * Concurrent rotation of the same file set from several processes is not
 * coordinated.
 */
public final class RotationPolicy {
    private static final Logger LOGGER = Logging.getLogger(RotationPolicy.class);

    private RotationPolicy() {
    }

    public static Path ensureUnderLimit(RotationConfig config) {
        return ensureUnderLimit(config.getBasePath(), config.getMaxSizeBytes(), config.getMaxFiles());
    }

    /**
     * Rotates {@code basePath} if it exists and its size is at least
     * {@code maxSizeBytes}; does nothing otherwise.
     *
     * @return {@code basePath}, which is free to be opened afterwards.
     * @throws IllegalArgumentException if the path is blank or either limit
     *         is not positive.
     */
    public static Path ensureUnderLimit(Path basePath, long maxSizeBytes, int maxFiles) {
        RedirectionPreconditions.checkPath(basePath);
        RedirectionPreconditions.checkLimits(maxSizeBytes, maxFiles);
        long size;
        try {
            size = Files.size(basePath);
        } catch (NoSuchFileException e) {
            return basePath;
        } catch (IOException | SecurityException e) {
            LOGGER.warn("Could not read size of {}; skipping rotation.", basePath, e);
            return basePath;
        }
        if (size >= maxSizeBytes) {
            LOGGER.debug("{} is {} bytes (limit {}); rotating.", basePath, size, maxSizeBytes);
            rotate(basePath, maxFiles);
        }
        return basePath;
    }

    /**
     * Performs one rotation step unconditionally.
     *
     * @return {@code true} if every rename succeeded.
     */
    @VisibleForTesting
    static boolean rotate(Path basePath, int maxFiles) {
        try {
            Files.deleteIfExists(PathNamer.rotatedName(basePath, maxFiles));
            for (int i = maxFiles - 1; i >= 1; --i) {
                Path source = PathNamer.rotatedName(basePath, i);
                if (Files.exists(source)) {
                    Path target = PathNamer.rotatedName(basePath, i + 1);
                    Files.deleteIfExists(target);
                    Files.move(source, target);
                }
            }
            Path first = PathNamer.rotatedName(basePath, 1);
            Files.deleteIfExists(first);
            if (Files.exists(basePath)) {
                Files.move(basePath, first);
            }
            LOGGER.info("Rotated {} (keeping at most {} backups).", basePath, maxFiles);
            return true;
        } catch (IOException | SecurityException e) {
            LOGGER.warn("Rotation of {} failed; continuing with the current file.", basePath, e);
            return false;
        }
    }
}
