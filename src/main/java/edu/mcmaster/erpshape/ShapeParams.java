package edu.mcmaster.erpshape;

import java.util.Arrays;

/**
 * Shape descriptors of a peak measured on the signal between its half-magnitude crossings.
 * All descriptors are NaN and all indices are -1 when a crossing could not be found.
 */
public class ShapeParams {
    public static final int NPARAMS = 7;

    public static final int FWHM = 0;
    public static final int RISE_TIME = 1;
    public static final int DECAY_TIME = 2;
    public static final int SYMMETRY = 3;
    public static final int SHARPNESS = 4;
    public static final int SHARPNESS_RISE = 5;
    public static final int SHARPNESS_DECAY = 6;

    public static final int UNDEFINED_INDEX = -1;

    private final double[] paramArray;
    private final int startIdx;
    private final int peakIdx;
    private final int endIdx;

    private ShapeParams(double[] paramArray, int startIdx, int peakIdx, int endIdx) {
        assert(paramArray.length == NPARAMS);
        this.paramArray = paramArray;
        this.startIdx = startIdx;
        this.peakIdx = peakIdx;
        this.endIdx = endIdx;
    }

    /**
     * Computes the descriptors from the crossing indices.
     *
     * @param positions sample positions of the signal
     * @param halfMagnitude half of the peak amplitude
     */
    public static ShapeParams compute(final double[] positions, final double halfMagnitude,
                                      final int startIdx, final int peakIdx, final int endIdx) {
        assert(startIdx < peakIdx && peakIdx < endIdx);
        final double fwhm = positions[endIdx] - positions[startIdx];
        final double riseTime = positions[peakIdx] - positions[startIdx];
        final double decayTime = positions[endIdx] - positions[peakIdx];
        final double symmetry = riseTime / fwhm;

        final double rise = Math.toDegrees(Math.atan(Math.abs(halfMagnitude) / riseTime));
        final double decay = Math.toDegrees(Math.atan(Math.abs(halfMagnitude) / decayTime));
        final double sharpnessRise = rise / 90;
        final double sharpnessDecay = decay / 90;
        // angle at the apex of the triangle formed by the crossings and the peak
        final double apex = 180 - (rise + decay);
        final double sharpness = 1 - apex / 180;

        double[] params = new double[NPARAMS];
        params[FWHM] = fwhm;
        params[RISE_TIME] = riseTime;
        params[DECAY_TIME] = decayTime;
        params[SYMMETRY] = symmetry;
        params[SHARPNESS] = sharpness;
        params[SHARPNESS_RISE] = sharpnessRise;
        params[SHARPNESS_DECAY] = sharpnessDecay;
        return new ShapeParams(params, startIdx, peakIdx, endIdx);
    }

    public static ShapeParams undefined(final int peakIdx) {
        double[] params = new double[NPARAMS];
        Arrays.fill(params, Double.NaN);
        return new ShapeParams(params, UNDEFINED_INDEX, peakIdx, UNDEFINED_INDEX);
    }

    public boolean isResolved() {
        return startIdx != UNDEFINED_INDEX && endIdx != UNDEFINED_INDEX;
    }

    public double[] toArray() {
        return paramArray.clone();
    }

    public double get(int idx) {
        return paramArray[idx];
    }

    public double getFwhm() {
        return paramArray[FWHM];
    }

    public double getRiseTime() {
        return paramArray[RISE_TIME];
    }

    public double getDecayTime() {
        return paramArray[DECAY_TIME];
    }

    public double getSymmetry() {
        return paramArray[SYMMETRY];
    }

    public double getSharpness() {
        return paramArray[SHARPNESS];
    }

    public double getSharpnessRise() {
        return paramArray[SHARPNESS_RISE];
    }

    public double getSharpnessDecay() {
        return paramArray[SHARPNESS_DECAY];
    }

    public int getStartIdx() {
        return startIdx;
    }

    public int getPeakIdx() {
        return peakIdx;
    }

    public int getEndIdx() {
        return endIdx;
    }

    /**
     * @return start, peak and end indices, with NaN for undefined ones
     */
    public double[] getIndices() {
        return new double[]{
                startIdx == UNDEFINED_INDEX ? Double.NaN : startIdx,
                peakIdx,
                endIdx == UNDEFINED_INDEX ? Double.NaN : endIdx};
    }

    @Override
    public String toString() {
        return "ShapeParams" + Arrays.toString(paramArray) + " [" + startIdx + ", " + peakIdx + ", " + endIdx + "]";
    }
}
