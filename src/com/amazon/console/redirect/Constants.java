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

public class Constants {
    public static final String DEFAULT_TIMESTAMP_FORMAT = "yyyyMMdd-HHmmss";
    public static final long DEFAULT_MAX_SIZE_BYTES = 10L * 1024 * 1024;
    public static final int DEFAULT_MAX_FILES = 10;
    /** Highest backup index inspected when summarizing a rotated file set. */
    public static final int MAX_ROTATION_INFO_SCAN = 100;
    /** Highest backup index inspected when deleting surplus backups. */
    public static final int MAX_CLEANUP_SCAN = 1000;
}
