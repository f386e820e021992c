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
package com.amazon.console.redirect;

import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;

import javax.annotation.Nullable;

import org.slf4j.Logger;

import com.amazon.console.redirect.config.Configuration;
import com.amazon.console.redirect.config.ConfigurationException;
import com.amazon.console.redirect.config.RedirectionConfiguration;
import com.amazon.console.redirect.config.RedirectionOptions;
import com.amazon.console.redirect.redirection.IRedirection;
import com.amazon.console.redirect.redirection.RedirectionFactory;
import com.amazon.console.redirect.redirection.RotationInfo;
import com.amazon.console.redirect.redirection.RotationPolicy;
import com.amazon.console.redirect.redirection.SystemOutputTarget;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.io.ByteStreams;

/**
 * Command line front end. With {@code --info}, {@code --cleanup} or
 * {@code --rotate} it maintains a rotated file set; otherwise it opens the
 * redirection described by {@code --configuration} and copies standard input
 * into it until end of stream.
 */
public class RedirectionTool {
    private static final Logger LOGGER = Logging.getLogger(RedirectionTool.class);

    public static void main(String[] args) throws Exception {
        RedirectionOptions opts = RedirectionOptions.parse(args);
        RedirectionConfiguration config = null;
        if (opts.getConfigFile() != null) {
            try {
                config = readConfigurationFile(Paths.get(opts.getConfigFile()));
            } catch (ConfigurationException e) {
                System.err.println(e.getMessage());
                System.exit(1);
            }
        }
        Path logFile = opts.getLogFile() != null ? Paths.get(opts.getLogFile()) : (config != null ? config.logFile() : null);
        String logLevel = opts.getLogLevel() != null ? opts.getLogLevel() : (config != null ? config.logLevel() : null);
        int logMaxBackupFileIndex = (config != null ? config.logMaxBackupIndex() : -1);
        long logMaxFileSize = (config != null ? config.logMaxFileSize() : -1L);
        Logging.initialize(logFile, logLevel, logMaxBackupFileIndex, logMaxFileSize);

        // Install an unhandled exception hook
        Thread.setDefaultUncaughtExceptionHandler(new Thread.UncaughtExceptionHandler() {
            @Override
            public void uncaughtException(Thread t, Throwable e) {
                String msg = "FATAL: Thread " + t.getName() + " threw an unrecoverable error. Aborting application";
                try {
                    try {   // We don't know if logging is still working
                        LOGGER.error(msg, e);
                    } finally {
                        System.err.println(msg);
                        e.printStackTrace();
                    }
                } finally {
                    System.exit(1);
                }
            }
        });

        System.exit(run(opts, config, System.in, System.out));
    }

    /**
     * Runs the action selected by {@code opts}.
     *
     * @param out where summaries are printed.
     * @return the process exit status.
     */
    @VisibleForTesting
    static int run(RedirectionOptions opts, @Nullable RedirectionConfiguration config, InputStream input,
            PrintStream out) {
        try {
            if (opts.getInfoPath() != null) {
                printRotationInfo(out, opts.getInfoPath());
            } else if (opts.getCleanupPath() != null) {
                int deleted = RedirectionFactory.cleanupRotatedFiles(opts.getCleanupPath(), maxFiles(opts, config));
                out.println("Deleted " + deleted + " file(s).");
            } else if (opts.getRotatePath() != null) {
                RotationPolicy.ensureUnderLimit(Paths.get(opts.getRotatePath()), maxSizeBytes(opts, config),
                        maxFiles(opts, config));
                printRotationInfo(out, opts.getRotatePath());
            } else {
                if (config == null)
                    throw new ConfigurationException(
                            "Nothing to do: give --info, --cleanup, --rotate or a --configuration with a basePath.");
                copyToRedirection(config, input);
            }
            return 0;
        } catch (Exception e) {
            LOGGER.error("Unhandled error.", e);
            System.err.println("Unhandled error: " + e.getMessage());
            return 1;
        }
    }

    private static void copyToRedirection(RedirectionConfiguration config, InputStream input) throws Exception {
        try (IRedirection redirection = RedirectionFactory.create(config)) {
            LOGGER.info("Copying standard input to {}", redirection.getFilePath());
            long copied = ByteStreams.copy(input, SystemOutputTarget.STDOUT.get());
            redirection.flush();
            LOGGER.info("Copied {} bytes to {}", copied, redirection.getFilePath());
        }
    }

    private static void printRotationInfo(PrintStream out, String basePath) {
        RotationInfo info = RedirectionFactory.getRotationInfo(basePath);
        if (info.isEmpty()) {
            out.println("No files found for " + basePath);
            return;
        }
        out.println("Files:      " + info.getFileCount());
        out.println("Total size: " + info.getTotalSize() + " bytes");
        out.println("Newest:     " + info.getNewestFile());
        out.println("Oldest:     " + info.getOldestFile());
    }

    private static int maxFiles(RedirectionOptions opts, @Nullable RedirectionConfiguration config) {
        if (opts.getMaxFiles() != null)
            return opts.getMaxFiles();
        return config != null ? config.maxFiles() : Constants.DEFAULT_MAX_FILES;
    }

    private static long maxSizeBytes(RedirectionOptions opts, @Nullable RedirectionConfiguration config) {
        if (opts.getMaxSizeBytes() != null)
            return opts.getMaxSizeBytes();
        return config != null ? config.maxSizeBytes() : Constants.DEFAULT_MAX_SIZE_BYTES;
    }

    private static RedirectionConfiguration readConfigurationFile(Path configFile) throws ConfigurationException {
        try {
            return new RedirectionConfiguration(Configuration.get(configFile));
        } catch (ConfigurationException ce) {
            throw ce;
        } catch (Exception e) {
            throw new ConfigurationException("Failed when reading configuration file: " + configFile, e);
        }
    }
}
