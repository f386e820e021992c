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

/**
 * How the target file of a configured redirection is chosen.
 */
public enum RedirectionType {
    /** Write to the base path as given. */
    SIMPLE,
    /** Insert a timestamp into the file name, one file per session. */
    TIMESTAMPED,
    /** Rotate the base file into numbered backups once it is too large. */
    ROTATING,
    /** Timestamp first, then rotate the timestamped file. */
    TIMESTAMPED_ROTATING
}
