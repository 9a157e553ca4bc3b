package org.tsfeatures.trimnorm.utils;

import org.testng.Assert;
import org.testng.annotations.Test;
import org.tsfeatures.trimnorm.testutils.BaseTest;

public final class ClassLabelUtilsUnitTest extends BaseTest {

    @Test
    public void testIndicatorsWithDefaultNumberOfClasses() {
        final boolean[][] indicators = ClassLabelUtils.toBinaryIndicators(new int[] {1, 3, 1, 2});
        Assert.assertEquals(indicators.length, 3);
        Assert.assertEquals(indicators[0], new boolean[] {true, false, true, false});
        Assert.assertEquals(indicators[1], new boolean[] {false, false, false, true});
        Assert.assertEquals(indicators[2], new boolean[] {false, true, false, false});
    }

    @Test
    public void testIndicatorsWithExplicitNumberOfClasses() {
        final boolean[][] indicators = ClassLabelUtils.toBinaryIndicators(new int[] {2, 5, 0}, 3);
        Assert.assertEquals(indicators.length, 3);
        Assert.assertEquals(indicators[0], new boolean[] {false, false, false});
        Assert.assertEquals(indicators[1], new boolean[] {true, false, false});
        Assert.assertEquals(indicators[2], new boolean[] {false, false, false});
    }

    @Test
    public void testNoLabels() {
        Assert.assertEquals(ClassLabelUtils.toBinaryIndicators(new int[0]).length, 0);
        Assert.assertEquals(ClassLabelUtils.toBinaryIndicators(new int[] {0, -1}).length, 0);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNegativeNumberOfClasses() {
        ClassLabelUtils.toBinaryIndicators(new int[] {1}, -1);
    }
}
