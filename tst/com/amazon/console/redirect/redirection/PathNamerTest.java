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

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.regex.Pattern;

import org.joda.time.DateTime;
import org.joda.time.format.DateTimeFormat;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import com.amazon.console.redirect.testing.TestUtils.TestBase;

/**
 * Unit tests for {@link PathNamer}.
 */
public class PathNamerTest extends TestBase {
    private static final DateTime TIME = new DateTime(2025, 7, 26, 14, 30, 52);

    @DataProvider(name = "timestamped")
    public Object[][] testTimestampedData() {
        return new Object[][] {
                { "logs/app.log", "logs/app-20250726-143052.log" },
                { "app.log", "app-20250726-143052.log" },
                { "app", "app-20250726-143052" },
                { "/var/log/deep/dir/service.out.txt", "/var/log/deep/dir/service.out-20250726-143052.txt" },
                { ".profile", ".profile-20250726-143052" }, };
    }

    @Test(dataProvider = "timestamped")
    public void testTimestamped(String base, String expected) {
        Assert.assertEquals(PathNamer.timestamped(Paths.get(base), "yyyyMMdd-HHmmss", TIME), Paths.get(expected));
    }

    @Test
    public void testTimestampedWithCustomFormat() {
        Assert.assertEquals(PathNamer.timestamped(Paths.get("app.log"), "yyyy_MM_dd", TIME),
                Paths.get("app-2025_07_26.log"));
    }

    @Test
    public void testTimestampedUsesCurrentTime() {
        Path result = PathNamer.timestamped(Paths.get("logs/app.log"));
        Assert.assertEquals(result.getParent(), Paths.get("logs"));
        Assert.assertTrue(Pattern.matches("app-\\d{8}-\\d{6}\\.log", result.getFileName().toString()),
                result.toString());
    }

    @DataProvider(name = "secondResolutionFormats")
    public Object[][] testTimestampParsesBackData() {
        return new Object[][] { { "yyyyMMdd-HHmmss" }, { "yyyy-MM-dd_HH.mm.ss" }, };
    }

    @Test(dataProvider = "secondResolutionFormats")
    public void testTimestampParsesBackWithinCallWindow(String format) {
        DateTime before = DateTime.now().withMillisOfSecond(0);
        Path result = PathNamer.timestamped(Paths.get("logs/app.log"), format);
        DateTime after = DateTime.now();
        String name = result.getFileName().toString();
        Assert.assertTrue(name.startsWith("app-") && name.endsWith(".log"), name);
        String timestamp = name.substring("app-".length(), name.length() - ".log".length());
        DateTime parsed = DateTimeFormat.forPattern(format).parseDateTime(timestamp);
        Assert.assertFalse(parsed.isBefore(before), parsed + " is before " + before);
        Assert.assertFalse(parsed.isAfter(after), parsed + " is after " + after);
    }

    @Test
    public void testTimestampedDoesNotCreateDirectories() {
        Path base = testFiles.getTempFilePathWithName("not/there/app.log");
        PathNamer.timestamped(base, "yyyyMMdd", TIME);
        Assert.assertFalse(Files.exists(base.getParent()));
    }

    @DataProvider(name = "rotated")
    public Object[][] testRotatedNameData() {
        return new Object[][] {
                { "logs/app.log", 1, "logs/app.1.log" },
                { "logs/app.log", 12, "logs/app.12.log" },
                { "app", 3, "app.3" },
                { "archive.tar.gz", 2, "archive.tar.2.gz" }, };
    }

    @Test(dataProvider = "rotated")
    public void testRotatedName(String base, int index, String expected) {
        Assert.assertEquals(PathNamer.rotatedName(Paths.get(base), index), Paths.get(expected));
    }

    @Test
    public void testStemAndExtension() {
        Assert.assertEquals(PathNamer.stem(Paths.get("dir/app.log")), "app");
        Assert.assertEquals(PathNamer.extension(Paths.get("dir/app.log")), ".log");
        Assert.assertEquals(PathNamer.stem(Paths.get(".hidden")), ".hidden");
        Assert.assertEquals(PathNamer.extension(Paths.get(".hidden")), "");
        Assert.assertEquals(PathNamer.extension(Paths.get("noext")), "");
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testRotatedNameRejectsZeroIndex() {
        PathNamer.rotatedName(Paths.get("app.log"), 0);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testTimestampedRejectsBlankPath() {
        PathNamer.timestamped(Paths.get(" "), "yyyyMMdd", TIME);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testTimestampedRejectsEmptyFormat() {
        PathNamer.timestamped(Paths.get("app.log"), "", TIME);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testTimestampedRejectsNullPath() {
        PathNamer.timestamped(null, "yyyyMMdd", TIME);
    }
}
