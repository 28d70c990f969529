package edu.mcmaster.erpshape;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Measures reported peak parameters and shape descriptors of fitted bumps on the signal they were fitted to.
 */
public class ShapeMeasurements {
    public static final Logger logger = LoggerFactory.getLogger(ShapeMeasurements.class);

    private ShapeMeasurements() {
    }

    /**
     * Looks for the sample of largest magnitude within mean ± std × windowStd and reports its position
     * and value, with 2 × std as the width. The fitted height is not used: under overlapping bumps it does
     * not match the height of the signal.
     * When the window holds no sample the sample nearest to the mean is used.
     */
    public static PeakParams measurePeak(final Signal signal, final Bump bump, final double windowStd) {
        final double lo = bump.getMean() - bump.getStd() * windowStd;
        final double hi = bump.getMean() + bump.getStd() * windowStd;
        int best = -1;
        for (int i = 0; i < signal.size(); i++) {
            final double p = signal.getPosition(i);
            if (p < lo || p > hi) continue;
            if (best < 0 || Math.abs(signal.getValue(i)) > Math.abs(signal.getValue(best))) best = i;
        }
        if (best < 0) best = signal.nearestIndex(bump.getMean());
        return new PeakParams(signal.getPosition(best), signal.getValue(best), 2 * bump.getStd());
    }

    /**
     * Finds the half-magnitude crossings around the peak and computes the shape descriptors.
     * For a positive peak, the start is the last sample before the peak at or below half the amplitude and
     * the end the first sample after the peak at or below it; inequalities are reversed for a negative peak.
     *
     * @return descriptors, or {@link ShapeParams#undefined(int)} if a crossing is missing
     */
    public static ShapeParams measureShape(final Signal signal, final PeakParams peak) {
        final int peakIdx = signal.nearestIndex(peak.getCenter());
        final double halfMagnitude = peak.getPower() / 2;
        final boolean positive = peak.getPower() >= 0;

        int startIdx = ShapeParams.UNDEFINED_INDEX;
        for (int i = peakIdx - 1; i >= 0; i--) {
            if (crossed(signal.getValue(i), halfMagnitude, positive)) {
                startIdx = i;
                break;
            }
        }
        int endIdx = ShapeParams.UNDEFINED_INDEX;
        for (int i = peakIdx + 1; i < signal.size(); i++) {
            if (crossed(signal.getValue(i), halfMagnitude, positive)) {
                endIdx = i;
                break;
            }
        }
        if (startIdx == ShapeParams.UNDEFINED_INDEX || endIdx == ShapeParams.UNDEFINED_INDEX) {
            return ShapeParams.undefined(peakIdx);
        }
        return ShapeParams.compute(signal.getPositions(), halfMagnitude, startIdx, peakIdx, endIdx);
    }

    private static boolean crossed(final double value, final double halfMagnitude, final boolean positive) {
        return positive ? value <= halfMagnitude : value >= halfMagnitude;
    }

    /**
     * Measures peak and shape parameters of each bump.
     */
    public static List<FitPeak> measure(final Signal signal, final List<Bump> bumps, final double windowStd) {
        List<FitPeak> peaks = new ArrayList<>(bumps.size());
        for (Bump b : bumps) {
            FitPeak peak = new FitPeak(b);
            peak.setPeakParams(measurePeak(signal, b, windowStd));
            peak.setShapeParams(measureShape(signal, peak.getPeakParams()));
            peaks.add(peak);
        }
        return peaks;
    }

    /**
     * @return peaks whose shape could be measured, in the same order
     */
    public static List<FitPeak> dropUnresolvedPeaks(final List<FitPeak> peaks) {
        List<FitPeak> kept = new ArrayList<>(peaks.size());
        for (FitPeak p : peaks) {
            if (p.hasStatus(PeakStatus.CONVERGED)) kept.add(p);
            else logger.debug("drop peak with unresolved shape: {}", p);
        }
        return kept;
    }
}
