package org.tsfeatures.trimnorm;

import org.testng.Assert;
import org.testng.annotations.Test;
import org.tsfeatures.trimnorm.exceptions.UserException;
import org.tsfeatures.trimnorm.testutils.BaseTest;

public final class MainUnitTest extends BaseTest {

    @Test
    public void testUsageWithoutArguments() {
        final Object[] result = new Object[1];
        final String out = captureStdout(() -> result[0] = new Main().instanceMain(new String[0]));
        Assert.assertNull(result[0]);
        assertContains(out, "USAGE: trimnorm");
        assertContains(out, "TrimAndNormalizeFeatures");
    }

    @Test(expectedExceptions = UserException.class)
    public void testUnknownProgram() {
        captureStderr(() -> new Main().instanceMain(new String[] {"NormalizeEverything"}));
    }

    @Test
    public void testToolHelp() {
        final Object[] result = new Object[1];
        final String err = captureStderr(() -> result[0] = new Main().instanceMain(new String[] {"TrimAndNormalizeFeatures", "--help"}));
        Assert.assertEquals(result[0], 0);
        assertContains(err, "--normalization-function");
    }

    @Test(expectedExceptions = UserException.InvalidThreshold.class)
    public void testThresholdOutOfRangeIsUserError() {
        captureStderr(() -> new Main().instanceMain(new String[] {
                "TrimAndNormalizeFeatures",
                "--input", getSafeNonExistentFile("noBundle").getAbsolutePath(),
                "--feature-good-value-threshold", "1.5"}));
    }
}
