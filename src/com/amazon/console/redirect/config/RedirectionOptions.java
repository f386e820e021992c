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
package com.amazon.console.redirect.config;

import java.io.File;

import lombok.Getter;

import org.apache.commons.lang3.ArrayUtils;

import com.beust.jcommander.IParameterValidator;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Joiner;

@Parameters(separators = "=")
public class RedirectionOptions {

    private static final String PROGRAM_NAME = "console-redirect";
    private static final String[] VALID_LOG_LEVELS = { "TRACE", "DEBUG", "INFO", "WARN", "ERROR" };

    @Parameter(names = { "--configuration", "-c" }, description = "Path to a JSON file describing the redirection.", validateWith = FileReadableValidator.class)
    @Getter String configFile = null;

    @Parameter(names = { "--log-file", "-l" }, description = "Path to the tool's own log file.")
    @Getter String logFile = null;

    @Parameter(names = { "--log-level", "-L" }, description = "Log level. Can be one of: TRACE,DEBUG,INFO,WARN,ERROR.", validateWith = LogLevelValidator.class)
    @Getter String logLevel = null;

    @Parameter(names = "--info", description = "Print the number, total size, oldest and newest file of a rotated file set.")
    @Getter String infoPath = null;

    @Parameter(names = "--cleanup", description = "Delete backups of the given file numbered above --max-files.")
    @Getter String cleanupPath = null;

    @Parameter(names = "--rotate", description = "Rotate the given file if it is at least --max-size bytes.")
    @Getter String rotatePath = null;

    @Parameter(names = "--max-size", description = "Size in bytes at which a file is rotated.", validateWith = PositiveNumberValidator.class)
    @Getter Long maxSizeBytes = null;

    @Parameter(names = "--max-files", description = "Number of backups to keep.", validateWith = PositiveNumberValidator.class)
    @Getter Integer maxFiles = null;

    @Parameter(names = { "--help", "-h" }, help = true, description = "Display this help message")
    Boolean help;

    public static RedirectionOptions parse(String[] args) {
        RedirectionOptions opts = new RedirectionOptions();
        JCommander jc = new JCommander(opts);
        jc.setProgramName(PROGRAM_NAME);
        try {
            jc.parse(args);
        } catch (ParameterException e) {
            System.err.println(e.getMessage());
            jc.usage();
            System.exit(1);
        }
        if (opts.isHelp()) {
            jc.usage();
            System.exit(0);
        }
        return opts;
    }

    /**
     * Parses without exiting the process on bad input.
     *
     * @throws ParameterException if the arguments are invalid.
     */
    @VisibleForTesting
    public static RedirectionOptions parseStrict(String... args) {
        RedirectionOptions opts = new RedirectionOptions();
        new JCommander(opts).parse(args);
        return opts;
    }

    public boolean isHelp() {
        return Boolean.TRUE.equals(help);
    }

    public static class PositiveNumberValidator implements IParameterValidator {
        @Override
        public void validate(String name, String value)
                throws ParameterException {
            try {
                if (Long.parseLong(value) <= 0)
                    throw new ParameterException("Parameter " + name
                            + " should be greater than zero. Value " + value
                            + " is not valid.");
            } catch (NumberFormatException e) {
                throw new ParameterException("Parameter " + name
                        + " is not a valid number: " + value);
            }
        }
    }

    public static class LogLevelValidator implements IParameterValidator {
        @Override
        public void validate(String name, String value)
                throws ParameterException {
            if (ArrayUtils.indexOf(VALID_LOG_LEVELS, value) < 0)
                throw new ParameterException("Valid values for parameter "
                        + name + " are: "
                        + Joiner.on(",").join(VALID_LOG_LEVELS) + ". Value "
                        + value + " is not valid.");
        }
    }

    public static class FileReadableValidator implements IParameterValidator {
        @Override
        public void validate(String name, String value)
                throws ParameterException {
            File f = new File(value);
            if (!f.exists()) {
                throw new ParameterException("Parameter " + name
                        + " points to a file that doesn't exist: " + value);
            }
            if (!f.canRead()) {
                throw new ParameterException("Parameter " + name
                        + " points to a file that's not accessible: " + value);
            }
        }
    }
}
