package edu.mcmaster.erpshape;

public enum PeakStatus {
    /** fitted, shape not measured yet */
    FITTED,
    /** fitted and both half-magnitude crossings were found */
    CONVERGED,
    /** half-magnitude crossings could not be located, usually because the peak is too close to an edge */
    BADPEAK
}
