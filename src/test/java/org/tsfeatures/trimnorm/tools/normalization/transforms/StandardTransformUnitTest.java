package org.tsfeatures.trimnorm.tools.normalization.transforms;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;
import org.tsfeatures.trimnorm.testutils.BaseTest;

public final class StandardTransformUnitTest extends BaseTest {

    private static final double EPSILON = 1E-9;
    private static final double NaN = Double.NaN;

    @DataProvider(name = "columns")
    public Object[][] columns() {
        return new Object[][] {
                {StandardTransform.MAX_MIN, new double[] {1, 2, 3, NaN}, new double[] {0, 0.5, 1, NaN}},
                {StandardTransform.MAX_MIN, new double[] {4, 4, 4}, new double[] {NaN, NaN, NaN}},
                {StandardTransform.Z_SCORE, new double[] {1, 2, 3}, new double[] {-1, 0, 1}},
                {StandardTransform.Z_SCORE, new double[] {NaN, 1, 2, 3}, new double[] {NaN, -1, 0, 1}},
                {StandardTransform.SIGMOID, new double[] {1, 2, 3}, new double[] {0.2689414213699951, 0.5, 0.7310585786300049}},
                {StandardTransform.SCALED_SIGMOID, new double[] {1, 2, 3}, new double[] {0, 0.5, 1}},
                {StandardTransform.ROBUST_SIGMOID, new double[] {1, 2, 3}, new double[] {0.289050497374996, 0.5, 0.710949502625004}},
                {StandardTransform.SCALED_ROBUST_SIGMOID, new double[] {1, 2, 3}, new double[] {0, 0.5, 1}},
                {StandardTransform.MIXED_SIGMOID, new double[] {1, 2, 3, NaN}, new double[] {0, 0.5, 1, NaN}},
                // zero interquartile range: the scaled sigmoid is used
                {StandardTransform.MIXED_SIGMOID, new double[] {5, 5, 5, 5, 5, 5, 9}, new double[] {0, 0, 0, 0, 0, 0, 1}},
                {StandardTransform.SCALED_ROBUST_SIGMOID, new double[] {5, 5, 5, 5, 5, 5, 9}, new double[] {NaN, NaN, NaN, NaN, NaN, NaN, NaN}}
        };
    }

    @Test(dataProvider = "columns")
    public void testTransformColumn(final StandardTransform transform, final double[] column, final double[] expected) {
        final RealMatrix data = new Array2DRowRealMatrix(column.length, 1);
        data.setColumn(0, column);
        final RealMatrix result = transform.apply(data);
        assertEqualsDoubleArray(result.getColumn(0), expected, EPSILON);
    }

    @Test
    public void testColumnsAreIndependent() {
        final RealMatrix data = new Array2DRowRealMatrix(new double[][] {{1, 10}, {2, 30}, {3, 20}});
        final RealMatrix result = StandardTransform.MAX_MIN.apply(data);
        assertEqualsDoubleArray(result.getColumn(0), new double[] {0, 0.5, 1}, EPSILON);
        assertEqualsDoubleArray(result.getColumn(1), new double[] {0, 1, 0.5}, EPSILON);
    }

    @Test
    public void testInputIsNotModified() {
        final RealMatrix data = new Array2DRowRealMatrix(new double[][] {{1, 10}, {2, 30}, {3, 20}});
        final RealMatrix copy = data.copy();
        for (final StandardTransform transform : StandardTransform.values()) {
            final RealMatrix result = transform.apply(data);
            Assert.assertEquals(result.getRowDimension(), 3);
            Assert.assertEquals(result.getColumnDimension(), 2);
        }
        Assert.assertEquals(data, copy);
    }

    @Test
    public void testInterquartileRange() {
        Assert.assertEquals(StandardTransform.interquartileRange(new double[] {1, 2, 3}), 1.5, EPSILON);
        Assert.assertEquals(StandardTransform.interquartileRange(new double[] {5, 5, 5, 5, 5, 5, 9}), 0., EPSILON);
        Assert.assertTrue(Double.isNaN(StandardTransform.interquartileRange(new double[] {NaN, NaN})));
    }

    @Test
    public void testAllMissingColumnStaysMissing() {
        final double[] column = {NaN, NaN};
        for (final StandardTransform transform : StandardTransform.values()) {
            final RealMatrix data = new Array2DRowRealMatrix(2, 1);
            data.setColumn(0, column);
            assertEqualsDoubleArray(transform.apply(data).getColumn(0), column, 0.);
        }
    }
}
