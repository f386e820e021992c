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

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

import org.mockito.ArgumentCaptor;
import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import com.amazon.console.redirect.testing.TestUtils;
import com.amazon.console.redirect.testing.TestUtils.FakeOutputTarget;
import com.amazon.console.redirect.testing.TestUtils.TestBase;

/**
 * Unit tests for {@link ConsoleRedirection}.
 */
public class ConsoleRedirectionTest extends TestBase {
    private FakeOutputTarget target;
    private RedirectionRegistry registry;

    @BeforeMethod
    public void setupTarget() {
        target = new FakeOutputTarget();
        registry = new RedirectionRegistry();
    }

    @Test
    public void testOutputReachesFileAndTargetIsRestored() throws IOException {
        Path file = testFiles.getTempFilePathWithName("out.log");
        ConsoleRedirection redirection = ConsoleRedirection.open(file, target, registry);
        Assert.assertNotSame(target.get(), target.getOriginal());
        Assert.assertTrue(redirection.isActive());
        target.get().print("Test output");
        redirection.close();
        Assert.assertSame(target.get(), target.getOriginal());
        Assert.assertFalse(redirection.isActive());
        Assert.assertEquals(TestUtils.readFile(file), "Test output");
    }

    @Test
    public void testFileIsOpenedForAppend() throws IOException {
        Path file = testFiles.getTempFilePathWithName("append.log");
        TestUtils.appendToFile("first;", file);
        try (ConsoleRedirection redirection = ConsoleRedirection.open(file, target, registry)) {
            target.get().print("second");
        }
        Assert.assertEquals(TestUtils.readFile(file), "first;second");
    }

    @Test
    public void testParentDirectoriesAreCreated() throws IOException {
        Path file = testFiles.getTempFilePathWithName("deep/er/still/out.log");
        try (ConsoleRedirection redirection = ConsoleRedirection.open(file, target, registry)) {
            Assert.assertTrue(Files.exists(file));
            Assert.assertEquals(redirection.getFilePath(), RedirectionRegistry.canonicalize(file));
        }
    }

    @Test
    public void testFlushAndFileSize() throws IOException {
        Path file = testFiles.getTempFilePathWithName("size.log");
        try (ConsoleRedirection redirection = ConsoleRedirection.open(file, target, registry)) {
            target.get().print("0123456789");
            redirection.flush();
            Assert.assertEquals(redirection.getFileSize(), 10L);
        }
    }

    @Test
    public void testFileSizeStaysReadableAfterRelease() throws IOException {
        Path file = testFiles.getTempFilePathWithName("released.log");
        ConsoleRedirection redirection = ConsoleRedirection.open(file, target, registry);
        target.get().print("abc");
        redirection.close();
        Assert.assertEquals(redirection.getFileSize(), 3L);
    }

    @Test
    public void testFileSizeOfDeletedFileIsZero() throws IOException {
        Path file = testFiles.getTempFilePathWithName("deleted.log");
        try (ConsoleRedirection redirection = ConsoleRedirection.open(file, target, registry)) {
            Files.delete(file);
            Assert.assertEquals(redirection.getFileSize(), 0L);
        }
    }

    @Test(expectedExceptions = IllegalStateException.class, expectedExceptionsMessageRegExp = ".*already been released.*")
    public void testFlushAfterReleaseFails() throws IOException {
        ConsoleRedirection redirection = ConsoleRedirection.open(testFiles.getTempFilePathWithName("f.log"), target,
                registry);
        redirection.close();
        redirection.flush();
    }

    @Test
    public void testDoubleCloseReleasesOnce() throws IOException {
        Path file = testFiles.getTempFilePathWithName("twice.log");
        ConsoleRedirection first = ConsoleRedirection.open(file, target, registry);
        ConsoleRedirection second = ConsoleRedirection.open(file, target, registry);
        Assert.assertEquals(registry.countFor(file), 2);
        second.close();
        second.close();
        Assert.assertEquals(registry.countFor(file), 1);
        Assert.assertEquals(target.getSwapCount(), 3);
        first.close();
        Assert.assertEquals(registry.countFor(file), 0);
        Assert.assertSame(target.get(), target.getOriginal());
    }

    @Test
    public void testNestedRedirectionsRestoreInReverseOrder() throws IOException {
        ConsoleRedirection outer = ConsoleRedirection.open(testFiles.getTempFilePathWithName("outer.log"), target,
                registry);
        PrintStream outerSink = target.get();
        ConsoleRedirection inner = ConsoleRedirection.open(testFiles.getTempFilePathWithName("inner.log"), target,
                registry);
        target.get().print("inner");
        inner.close();
        Assert.assertSame(target.get(), outerSink);
        target.get().print("outer");
        outer.close();
        Assert.assertSame(target.get(), target.getOriginal());
        Assert.assertEquals(TestUtils.readFile(testFiles.getTempFilePathWithName("inner.log")), "inner");
        Assert.assertEquals(TestUtils.readFile(testFiles.getTempFilePathWithName("outer.log")), "outer");
    }

    @Test
    public void testOutOfOrderReleaseRestoresCapturedStream() throws IOException {
        ConsoleRedirection first = ConsoleRedirection.open(testFiles.getTempFilePathWithName("a.log"), target,
                registry);
        ConsoleRedirection second = ConsoleRedirection.open(testFiles.getTempFilePathWithName("b.log"), target,
                registry);
        first.close();
        Assert.assertSame(target.get(), target.getOriginal());
        Assert.assertTrue(second.isActive());
        second.close();
        Assert.assertFalse(second.isActive());
        Assert.assertTrue(registry.activePaths().isEmpty());
    }

    @Test
    public void testFailedRestoreStillClosesSink() throws IOException {
        Path file = testFiles.getTempFilePathWithName("restore.log");
        FailingSwapTarget failing = new FailingSwapTarget(2);
        ConsoleRedirection redirection = ConsoleRedirection.open(file, failing, registry);
        PrintStream sink = failing.get();
        sink.print("kept");
        redirection.close();
        Assert.assertFalse(redirection.isActive());
        Assert.assertEquals(registry.countFor(file), 0);
        sink.print(" after close");
        Assert.assertEquals(TestUtils.readFile(file), "kept");
    }

    @Test
    public void testFailedInstallLeavesNoTrace() throws IOException {
        Path file = testFiles.getTempFilePathWithName("install.log");
        FailingSwapTarget failing = new FailingSwapTarget(1);
        try {
            ConsoleRedirection.open(file, failing, registry);
            Assert.fail("Installing the redirection should fail.");
        } catch (IllegalStateException e) {
            Assert.assertEquals(e.getMessage(), "Target unavailable.");
        }
        Assert.assertEquals(registry.countFor(file), 0);
        Assert.assertTrue(registry.activePaths().isEmpty());
        Assert.assertSame(failing.get(), failing.getOriginal());
    }

    @Test
    public void testRestoresNullSystemOut() throws IOException {
        Path file = testFiles.getTempFilePathWithName("null-out.log");
        System.setOut(null);
        ConsoleRedirection redirection = ConsoleRedirection.open(file, SystemOutputTarget.STDOUT, registry);
        System.out.print("while null");
        redirection.close();
        Assert.assertNull(System.out);
        Assert.assertEquals(registry.countFor(file), 0);
        Assert.assertEquals(TestUtils.readFile(file), "while null");
    }

    @Test
    public void testSwapsThroughOutputTarget() throws IOException {
        PrintStream previous = new PrintStream(new ByteArrayOutputStream());
        IOutputTarget mockTarget = mock(IOutputTarget.class);
        when(mockTarget.swap(any(PrintStream.class))).thenReturn(previous);
        ConsoleRedirection redirection = ConsoleRedirection.open(testFiles.getTempFilePathWithName("mock.log"),
                mockTarget, registry);
        redirection.close();
        ArgumentCaptor<PrintStream> swapped = ArgumentCaptor.forClass(PrintStream.class);
        verify(mockTarget, times(2)).swap(swapped.capture());
        Assert.assertNotSame(swapped.getAllValues().get(0), previous);
        Assert.assertSame(swapped.getAllValues().get(1), previous);
    }

    @Test
    public void testRedirectsSystemOut() throws IOException {
        Path file = testFiles.getTempFilePathWithName("stdout.log");
        PrintStream before = System.out;
        int registered = RedirectionRegistry.getDefault().countFor(file);
        ConsoleRedirection redirection = ConsoleRedirection.open(file.toString());
        Assert.assertNotSame(System.out, before);
        Assert.assertEquals(RedirectionRegistry.getDefault().countFor(file), registered + 1);
        System.out.print("via System.out");
        redirection.close();
        Assert.assertSame(System.out, before);
        Assert.assertEquals(RedirectionRegistry.getDefault().countFor(file), registered);
        Assert.assertEquals(TestUtils.readFile(file), "via System.out");
    }

    @Test
    public void testRedirectsSystemErr() throws IOException {
        Path file = testFiles.getTempFilePathWithName("stderr.log");
        PrintStream before = System.err;
        try (ConsoleRedirection redirection = ConsoleRedirection.open(file, SystemOutputTarget.STDERR)) {
            Assert.assertNotSame(System.err, before);
        }
        Assert.assertSame(System.err, before);
    }

    @Test
    public void testUnreachableRedirectionIsReleased() throws Exception {
        Path file = testFiles.getTempFilePathWithName("forgotten.log");
        openAndForget(file);
        long deadline = System.currentTimeMillis() + 10_000;
        while (registry.countFor(file) > 0 && System.currentTimeMillis() < deadline) {
            System.gc();
            Thread.sleep(50);
        }
        Assert.assertEquals(registry.countFor(file), 0);
        Assert.assertSame(target.get(), target.getOriginal());
    }

    private void openAndForget(Path file) throws IOException {
        ConsoleRedirection.open(file, target, registry);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNullPathIsRejected() throws IOException {
        ConsoleRedirection.open((String) null);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testBlankPathIsRejected() throws IOException {
        ConsoleRedirection.open("   ");
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testIllegalCharactersAreRejected() throws IOException {
        ConsoleRedirection.open("bad\u0000name.log");
    }

    @Test
    public void testOpenFailureLeavesNoTrace() throws IOException {
        Path notADirectory = TestUtils.writeBytes(testFiles.getTempFilePathWithName("plain-file"), 1);
        Path file = notADirectory.resolve("out.log");
        try {
            ConsoleRedirection.open(file, target, registry);
            Assert.fail("Opening a file under a regular file should fail.");
        } catch (IOException e) {
            Assert.assertTrue(e.getMessage().contains(file.toString()), e.getMessage());
            Assert.assertNotNull(e.getCause());
        }
        Assert.assertEquals(registry.countFor(file), 0);
        Assert.assertEquals(target.getSwapCount(), 0);
    }

    @Test
    public void testToStringShowsState() throws IOException {
        ConsoleRedirection redirection = ConsoleRedirection.open(testFiles.getTempFilePathWithName("s.log"), target,
                registry);
        Assert.assertTrue(redirection.toString().contains("s.log"));
        redirection.close();
        Assert.assertTrue(redirection.toString().contains("released"));
    }

    /**
     * Output target whose n-th swap fails.
     */
    private static final class FailingSwapTarget extends FakeOutputTarget {
        private final int failingSwap;

        FailingSwapTarget(int failingSwap) {
            this.failingSwap = failingSwap;
        }

        @Override
        public synchronized PrintStream swap(PrintStream replacement) {
            if (getSwapCount() + 1 == failingSwap)
                throw new IllegalStateException("Target unavailable.");
            return super.swap(replacement);
        }
    }
}
