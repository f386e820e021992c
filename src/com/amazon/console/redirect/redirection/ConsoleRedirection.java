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

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.lang.ref.Cleaner;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.atomic.AtomicBoolean;

import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

import lombok.Getter;

import org.slf4j.Logger;

import com.amazon.console.redirect.Logging;
import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Redirects an {@link IOutputTarget} (by default {@code System.out}) into a
 * file opened in append mode. Output is buffered and reaches the file on
 * {@link #flush()} or {@link #close()}.
 *
 * Redirections nest: each one remembers the stream it displaced and puts it
 * back when released, so handles should be closed in reverse order of
 * opening. A handle that becomes unreachable without being closed is
 * released by a {@link Cleaner}; callers should not rely on it.
 */
@ThreadSafe
public class ConsoleRedirection implements IRedirection {
    private static final Logger LOGGER = Logging.getLogger(ConsoleRedirection.class);
    private static final Cleaner CLEANER = Cleaner.create(new ThreadFactoryBuilder()
            .setNameFormat("redirection-cleaner-%d").setDaemon(true).build());

    @Getter private final Path filePath;
    private final Release release;
    private final Cleaner.Cleanable cleanable;

    public static ConsoleRedirection open(String filePath) throws IOException {
        return open(RedirectionPreconditions.checkPath(filePath));
    }

    public static ConsoleRedirection open(Path filePath) throws IOException {
        return open(filePath, SystemOutputTarget.STDOUT, RedirectionRegistry.getDefault());
    }

    public static ConsoleRedirection open(Path filePath, IOutputTarget target) throws IOException {
        return open(filePath, target, RedirectionRegistry.getDefault());
    }

    /**
     * Opens (creating it and any missing parent directories) the file,
     * counts it in {@code registry}, and installs it on {@code target}.
     *
     * @throws IllegalArgumentException if the path is blank, contains
     *         illegal characters, or does not name a file.
     * @throws IOException if the file or its directories cannot be created
     *         or opened. Nothing is registered or swapped in that case.
     */
    public static ConsoleRedirection open(Path filePath, IOutputTarget target, RedirectionRegistry registry)
            throws IOException {
        return new ConsoleRedirection(filePath, target, registry);
    }

    protected ConsoleRedirection(Path filePath, IOutputTarget target, RedirectionRegistry registry)
            throws IOException {
        RedirectionPreconditions.checkPath(filePath);
        Preconditions.checkNotNull(target);
        Preconditions.checkNotNull(registry);
        Path absolute = filePath.toAbsolutePath().normalize();
        PrintStream sink = openSink(absolute);
        this.filePath = registry.register(absolute);
        this.release = new Release(this.filePath, sink, target, registry);
        try {
            this.release.previous = target.swap(sink);
        } catch (RuntimeException e) {
            release.released.set(true);
            sink.close();
            registry.release(this.filePath);
            throw e;
        }
        this.cleanable = CLEANER.register(this, this.release);
        LOGGER.debug("Redirected {} to {}", target, this.filePath);
    }

    private static PrintStream openSink(Path file) throws IOException {
        try {
            Path parent = file.getParent();
            if (parent != null)
                Files.createDirectories(parent);
            OutputStream out = Files.newOutputStream(file,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
            return new PrintStream(new BufferedOutputStream(out), false, StandardCharsets.UTF_8);
        } catch (IOException | SecurityException e) {
            throw new IOException("Cannot redirect output to " + file + ": " + e, e);
        }
    }

    @Override
    public boolean isActive() {
        return !release.released.get();
    }

    @Override
    public void flush() {
        Preconditions.checkState(isActive(), "Redirection to %s has already been released.", filePath);
        release.sink.flush();
    }

    /**
     * Reports the size on disk, so output still sitting in the buffer is not
     * counted. The size stays readable after the redirection is released.
     */
    @Override
    public long getFileSize() {
        try {
            return Files.size(filePath);
        } catch (NoSuchFileException e) {
            return 0;
        } catch (IOException | SecurityException e) {
            LOGGER.debug("Cannot read size of {}", filePath, e);
            return 0;
        }
    }

    @Override
    public void close() {
        cleanable.clean();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + filePath + (isActive() ? "" : ", released") + ")";
    }

    /**
     * Release action shared by {@link #close()} and the cleaner. It must not
     * refer back to the redirection, or the cleaner would never run it.
     */
    private static final class Release implements Runnable {
        private final Path path;
        private final PrintStream sink;
        private final IOutputTarget target;
        private final RedirectionRegistry registry;
        private final AtomicBoolean released = new AtomicBoolean(false);
        @Nullable private volatile PrintStream previous;

        Release(Path path, PrintStream sink, IOutputTarget target, RedirectionRegistry registry) {
            this.path = path;
            this.sink = sink;
            this.target = target;
            this.registry = registry;
        }

        @Override
        public void run() {
            if (!released.compareAndSet(false, true))
                return;
            try {
                try {
                    PrintStream displaced = target.swap(previous);
                    if (displaced != sink) {
                        LOGGER.warn("Redirection to {} released out of order; {} now points at the stream "
                                + "that was installed before it.", path, target);
                    }
                } catch (RuntimeException e) {
                    LOGGER.error("Could not restore {} after redirecting it to {}", target, path, e);
                }
                sink.flush();
                if (sink.checkError())
                    LOGGER.warn("Errors occurred while writing redirected output to {}", path);
                sink.close();
                LOGGER.debug("Released redirection of {} to {}", target, path);
            } finally {
                registry.release(path);
            }
        }
    }
}
