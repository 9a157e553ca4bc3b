package org.tsfeatures.trimnorm.cmdline.programgroups;

import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;

/**
 * Tools that filter and transform time-series feature matrices
 */
public class FeatureMatrixProgramGroup implements CommandLineProgramGroup {

    @Override
    public String getName() { return "Feature Matrix"; }

    @Override
    public String getDescription() { return "Tools that trim and normalize time-series feature matrices"; }
}
