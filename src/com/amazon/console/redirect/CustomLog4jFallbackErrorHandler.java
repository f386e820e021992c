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

import java.io.PrintStream;

import org.apache.log4j.spi.LoggingEvent;
import org.apache.log4j.varia.FallbackErrorHandler;
import org.joda.time.DateTime;
import org.joda.time.format.DateTimeFormat;

/**
 * Remembers why the primary log appender failed so {@link Logging} can report
 * it once the fallback appender is in place.
 */
public class CustomLog4jFallbackErrorHandler extends FallbackErrorHandler {
    private static final String RULE = "# ********************************************************************************";
    private static final StringBuilder errorHeader = new StringBuilder();

    /**
     * @return A description of the errors that triggered the fallback, or
     *         {@code null} if no errors occurred.
     */
    public static synchronized String getErrorHeader() {
        return errorHeader.length() == 0 ? null : errorHeader.toString();
    }

    public static String getFallbackLogFile() {
        return System.getProperty("java.io.tmpdir") + "/fallback-console-redirect.log";
    }

    /**
     * Writes to {@code System.err} directly: the console may be redirected by
     * the very library whose logging failed.
     */
    @Override
    public void error(String message, Exception e, int errorCode, LoggingEvent event) {
        String header;
        synchronized (CustomLog4jFallbackErrorHandler.class) {
            errorHeader.append(RULE).append('\n')
                    .append("# ").append(DateTime.now().toString(DateTimeFormat.forPattern("EEE, d MMM yyyy HH:mm:ss Z")))
                    .append('\n')
                    .append("# Logging could not write to its configured file:").append('\n')
                    .append("#    ").append(message).append('\n');
            if (e != null) {
                errorHeader.append("#    ").append(e.getClass().getName()).append(": ").append(e.getMessage())
                        .append('\n');
            }
            errorHeader.append("# Log output goes to ").append(getFallbackLogFile()).append(" until this is fixed.")
                    .append('\n')
                    .append(RULE).append('\n');
            header = errorHeader.toString();
        }
        PrintStream err = System.err;
        err.println(header);
        super.error(message, e, errorCode, event);
    }
}
