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

import java.nio.file.Path;
import java.util.Map;

import com.amazon.console.redirect.Constants;
import com.amazon.console.redirect.redirection.RotationConfig;
import com.google.common.collect.Range;

public class RedirectionConfiguration extends Configuration {
    public static final String BASE_PATH_KEY = "basePath";
    public static final String REDIRECTION_TYPE_KEY = "redirectionType";
    public static final String MAX_SIZE_BYTES_KEY = "maxSizeBytes";
    public static final String MAX_FILES_KEY = "maxFiles";
    public static final String TIMESTAMP_FORMAT_KEY = "timestampFormat";
    static final String LOG_FILE_KEY = "log.file";
    static final String LOG_LEVEL_KEY = "log.level";
    static final String LOG_MAX_BACKUP_INDEX_KEY = "log.maxBackupIndex";
    static final String LOG_MAX_FILE_SIZE_KEY = "log.maxFileSize";

    public RedirectionConfiguration(Map<String, Object> config) {
        super(config);
    }

    public RedirectionConfiguration(Configuration config) {
        this(config.getConfigMap());
    }

    public Path basePath() {
        return readPath(BASE_PATH_KEY);
    }

    public RedirectionType redirectionType() {
        return readEnum(RedirectionType.class, REDIRECTION_TYPE_KEY, RedirectionType.SIMPLE);
    }

    public long maxSizeBytes() {
        long value = readLong(MAX_SIZE_BYTES_KEY, Constants.DEFAULT_MAX_SIZE_BYTES);
        validateRange(value, Range.atLeast(1L), MAX_SIZE_BYTES_KEY);
        return value;
    }

    public int maxFiles() {
        int value = readInteger(MAX_FILES_KEY, Constants.DEFAULT_MAX_FILES);
        validateRange(value, Range.atLeast(1), MAX_FILES_KEY);
        return value;
    }

    public String timestampFormat() {
        return readString(TIMESTAMP_FORMAT_KEY, Constants.DEFAULT_TIMESTAMP_FORMAT);
    }

    public RotationConfig toRotationConfig() {
        return new RotationConfig(basePath(), maxSizeBytes(), maxFiles(), timestampFormat());
    }

    public String logLevel() {
        return readString(LOG_LEVEL_KEY, null);
    }

    public Path logFile() {
        return readPath(LOG_FILE_KEY, null);
    }

    public int logMaxBackupIndex() {
        return readInteger(LOG_MAX_BACKUP_INDEX_KEY, -1);
    }

    public long logMaxFileSize() {
        return readLong(LOG_MAX_FILE_SIZE_KEY, -1L);
    }
}
