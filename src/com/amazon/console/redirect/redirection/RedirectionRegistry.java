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
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

import org.apache.commons.lang3.StringUtils;

import com.google.common.base.Preconditions;
import com.google.common.collect.ConcurrentHashMultiset;
import com.google.common.collect.ImmutableList;

/**
 * Counts live redirections per file. Paths are canonicalized before use, so
 * {@code logs/../logs/app.log} and {@code logs/app.log} share one count.
 * Counts never go below zero and paths whose count drops to zero are
 * forgotten.
 */
@ThreadSafe
public class RedirectionRegistry {
    private static final RedirectionRegistry DEFAULT = new RedirectionRegistry();

    private final ConcurrentHashMultiset<Path> counts = ConcurrentHashMultiset.create();

    /**
     * @return the process-wide registry used by redirections opened without
     *         an explicit registry.
     */
    public static RedirectionRegistry getDefault() {
        return DEFAULT;
    }

    /**
     * @return the key this path was counted under.
     */
    public Path register(Path path) {
        Path key = canonicalize(path);
        counts.add(key);
        return key;
    }

    public void release(Path path) {
        counts.remove(canonicalize(path));
    }

    public int countFor(@Nullable Path path) {
        return path == null ? 0 : counts.count(canonicalize(path));
    }

    /**
     * @return 0 for null, blank or unparseable paths.
     */
    public int countFor(@Nullable String path) {
        if (StringUtils.isBlank(path))
            return 0;
        try {
            return countFor(Paths.get(path));
        } catch (InvalidPathException e) {
            return 0;
        }
    }

    /**
     * @return a snapshot of the paths with at least one live redirection.
     */
    public List<Path> activePaths() {
        ImmutableList.Builder<Path> active = ImmutableList.builder();
        for (Path path : counts.elementSet()) {
            if (counts.count(path) > 0)
                active.add(path);
        }
        return active.build();
    }

    /**
     * Absolute, normalized, and with symbolic links resolved when the file
     * exists. A path for a file that does not exist yet is only normalized.
     */
    public static Path canonicalize(Path path) {
        Preconditions.checkNotNull(path);
        Path absolute = path.toAbsolutePath().normalize();
        try {
            return absolute.toRealPath();
        } catch (IOException | SecurityException e) {
            return absolute;
        }
    }
}
