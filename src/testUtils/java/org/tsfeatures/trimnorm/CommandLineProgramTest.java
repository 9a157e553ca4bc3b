package org.tsfeatures.trimnorm;

import org.tsfeatures.trimnorm.testutils.BaseTest;
import org.tsfeatures.trimnorm.testutils.CommandLineProgramTester;

/**
 * Utility class for command line program testing.
 */
public abstract class CommandLineProgramTest extends BaseTest implements CommandLineProgramTester {

    @Override
    public String getTestedToolName() {
        return getTestedClassName();
    }
}
