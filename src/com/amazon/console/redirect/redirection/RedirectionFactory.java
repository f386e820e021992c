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
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import javax.annotation.Nullable;

import org.apache.commons.lang3.StringUtils;
import org.joda.time.Duration;
import org.slf4j.Logger;

import com.amazon.console.redirect.Constants;
import com.amazon.console.redirect.Logging;
import com.amazon.console.redirect.config.RedirectionConfiguration;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningScheduledExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Entry points combining {@link PathNamer}, {@link RotationPolicy} and
 * {@link ConsoleRedirection}, plus maintenance helpers for rotated file sets.
 */
public final class RedirectionFactory {
    private static final Logger LOGGER = Logging.getLogger(RedirectionFactory.class);

    private static final ListeningScheduledExecutorService RELEASE_SCHEDULER = MoreExecutors.listeningDecorator(
            Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                    .setNameFormat("redirection-release-%d").setDaemon(true).build()));

    private RedirectionFactory() {
    }

    /**
     * Opens the redirection described by a configuration.
     */
    public static IRedirection create(RedirectionConfiguration config) throws IOException {
        Path basePath = config.basePath();
        switch (config.redirectionType()) {
        case TIMESTAMPED:
            return createTimestamped(basePath, config.timestampFormat());
        case ROTATING:
            return createRotating(basePath, config.maxSizeBytes(), config.maxFiles());
        case TIMESTAMPED_ROTATING:
            return createTimestampedRotating(config.toRotationConfig());
        case SIMPLE:
        default:
            return ConsoleRedirection.open(basePath);
        }
    }

    public static IRedirection createTimestamped(Path basePath) throws IOException {
        return createTimestamped(basePath, Constants.DEFAULT_TIMESTAMP_FORMAT);
    }

    public static IRedirection createTimestamped(Path basePath, String format) throws IOException {
        return ConsoleRedirection.open(PathNamer.timestamped(basePath, format));
    }

    public static IRedirection createRotating(Path basePath, long maxSizeBytes) throws IOException {
        return createRotating(basePath, maxSizeBytes, Constants.DEFAULT_MAX_FILES);
    }

    public static IRedirection createRotating(Path basePath, long maxSizeBytes, int maxFiles) throws IOException {
        return ConsoleRedirection.open(RotationPolicy.ensureUnderLimit(basePath, maxSizeBytes, maxFiles));
    }

    public static IRedirection createTimestampedRotating(Path basePath, long maxSizeBytes, int maxFiles)
            throws IOException {
        return createTimestampedRotating(basePath, maxSizeBytes, maxFiles, Constants.DEFAULT_TIMESTAMP_FORMAT);
    }

    /**
     * Timestamps the path first, then applies the rotation policy to the
     * timestamped file.
     */
    public static IRedirection createTimestampedRotating(Path basePath, long maxSizeBytes, int maxFiles,
            String format) throws IOException {
        RedirectionPreconditions.checkLimits(maxSizeBytes, maxFiles);
        Path timestamped = PathNamer.timestamped(basePath, format);
        return ConsoleRedirection.open(RotationPolicy.ensureUnderLimit(timestamped, maxSizeBytes, maxFiles));
    }

    public static IRedirection createTimestampedRotating(RotationConfig config) throws IOException {
        return createTimestampedRotating(config.getBasePath(), config.getMaxSizeBytes(), config.getMaxFiles(),
                config.getTimestampFormat());
    }

    /**
     * Redirects output to {@code basePath} for {@code duration}. The
     * redirection is opened before this method returns and released later on
     * a shared daemon thread.
     *
     * @return a future that completes once the redirection is released.
     *         Cancelling it releases the redirection immediately.
     * @throws IOException if the redirection cannot be opened.
     */
    public static ListenableFuture<Void> createTemporary(Path basePath, Duration duration) throws IOException {
        Preconditions.checkNotNull(duration);
        return releaseAfter(ConsoleRedirection.open(basePath), duration, RELEASE_SCHEDULER);
    }

    @VisibleForTesting
    static ListenableFuture<Void> releaseAfter(final IRedirection redirection, Duration duration,
            ListeningScheduledExecutorService scheduler) {
        if (duration.getMillis() <= 0) {
            redirection.close();
            return Futures.immediateFuture(null);
        }
        ListenableFuture<Void> released = scheduler.schedule(new Callable<Void>() {
            @Override
            public Void call() {
                redirection.close();
                return null;
            }
        }, duration.getMillis(), TimeUnit.MILLISECONDS);
        // Also runs on cancellation; close() is idempotent.
        released.addListener(new Runnable() {
            @Override
            public void run() {
                redirection.close();
            }
        }, MoreExecutors.directExecutor());
        return released;
    }

    /**
     * @see #cleanupRotatedFiles(Path, int)
     */
    public static int cleanupRotatedFiles(@Nullable String basePath, int maxFiles) {
        Path path = toPathOrNull(basePath);
        return path == null ? 0 : cleanupRotatedFiles(path, maxFiles);
    }

    /**
     * Deletes backups numbered above {@code maxFiles}. Gaps in the numbering
     * are skipped over.
     *
     * @return the number of files deleted. Errors end the scan early and are
     *         not reported.
     */
    public static int cleanupRotatedFiles(@Nullable Path basePath, int maxFiles) {
        if (!isUsablePath(basePath) || maxFiles <= 0)
            return 0;
        int deleted = 0;
        try {
            for (int i = maxFiles + 1; i <= Constants.MAX_CLEANUP_SCAN; ++i) {
                if (Files.deleteIfExists(PathNamer.rotatedName(basePath, i)))
                    ++deleted;
            }
        } catch (IOException | SecurityException e) {
            LOGGER.debug("Cleanup of backups of {} stopped after {} deletions.", basePath, deleted, e);
        }
        if (deleted > 0)
            LOGGER.info("Deleted {} surplus backups of {}", deleted, basePath);
        return deleted;
    }

    /**
     * @see #getRotationInfo(Path)
     */
    public static RotationInfo getRotationInfo(@Nullable String basePath) {
        Path path = toPathOrNull(basePath);
        return path == null ? RotationInfo.EMPTY : getRotationInfo(path);
    }

    /**
     * Summarizes the base file and its backups {@code 1, 2, ...} up to the
     * first missing index.
     *
     * @return {@link RotationInfo#EMPTY} if there are no files or they cannot
     *         be read.
     */
    public static RotationInfo getRotationInfo(@Nullable Path basePath) {
        if (!isUsablePath(basePath))
            return RotationInfo.EMPTY;
        try {
            int count = 0;
            long totalSize = 0;
            Path newest = null;
            Path oldest = null;
            if (Files.exists(basePath)) {
                ++count;
                totalSize += Files.size(basePath);
                newest = basePath;
                oldest = basePath;
            }
            for (int i = 1; i <= Constants.MAX_ROTATION_INFO_SCAN; ++i) {
                Path backup = PathNamer.rotatedName(basePath, i);
                if (!Files.exists(backup))
                    break;
                ++count;
                totalSize += Files.size(backup);
                if (newest == null)
                    newest = backup;
                oldest = backup;
            }
            return count == 0 ? RotationInfo.EMPTY : new RotationInfo(count, totalSize, oldest, newest);
        } catch (IOException | SecurityException e) {
            LOGGER.debug("Cannot summarize rotated files of {}", basePath, e);
            return RotationInfo.EMPTY;
        }
    }

    private static boolean isUsablePath(@Nullable Path path) {
        return path != null && path.getFileName() != null && !StringUtils.isBlank(path.toString());
    }

    @Nullable
    private static Path toPathOrNull(@Nullable String path) {
        if (StringUtils.isBlank(path))
            return null;
        try {
            return Paths.get(path);
        } catch (InvalidPathException e) {
            return null;
        }
    }
}
