package edu.mcmaster.erpshape;

import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

public class Util {
    public static final Logger logger = LoggerFactory.getLogger(Util.class);

    /** converts a full width at half maximum to a gaussian std */
    public static final double FWHM_TO_STD = 1.0 / (2.0 * Math.sqrt(2.0 * Math.log(2.0)));

    public static double computeGaussStd(final double fwhm) {
        return fwhm * FWHM_TO_STD;
    }

    public static double computeFwhm(final double std) {
        return std / FWHM_TO_STD;
    }

    /**
     * @return index of the sample with the largest magnitude. The positive maximum wins when it
     * has the same magnitude as the negative minimum; the first index wins among equal values.
     */
    public static int argMaxAbs(final double[] values) {
        assert(values.length > 0);
        int maxIdx = 0;
        int minIdx = 0;
        for (int i = 1; i < values.length; i++) {
            if (values[i] > values[maxIdx]) maxIdx = i;
            if (values[i] < values[minIdx]) minIdx = i;
        }
        return Math.abs(values[minIdx]) > Math.abs(values[maxIdx]) ? minIdx : maxIdx;
    }

    /**
     * population standard deviation
     */
    public static double std(final double[] values) {
        return new StandardDeviation(false).evaluate(values);
    }

    /*
     * findPeakGuesses(positions, signal, resolution, settings)
     *
     * Greedy search for gaussian guesses. The sample of largest magnitude of the residual
     * is taken as the center of a new guess, whose std is estimated from the half-height
     * crossings around it; the guess is then subtracted from the residual. Stops when
     * maxNPeaks guesses are found, or when the largest magnitude does not exceed
     * peakThreshold × std(residual) or minPeakHeight.
     *
     * The std estimate is quantized to the sampling, so each subtraction leaves lobes of a few
     * percent of the guess height around it. The search also stops when the largest magnitude is
     * such a lobe (see isSubtractionRinging), when it falls below RESIDUAL_FLOOR times the largest
     * magnitude of the input, or after one guess per sample.
     *
     * residual - working copy of the signal, modified in place.
     *
     * Returns the guesses in the order they were found.
     */
    public static List<Bump> findPeakGuesses(final double[] positions,
                                             final double[] residual,
                                             final double resolution,
                                             final FitSettings settings)
    {
        assert(positions.length == residual.length);
        final double[] stdLimits = settings.getGaussStdLimits();
        final double inputMagnitude = Math.abs(residual[argMaxAbs(residual)]);
        List<Bump> guesses = new ArrayList<>();
        while (guesses.size() < settings.maxNPeaks && guesses.size() < residual.length) {
            final int maxIdx = argMaxAbs(residual);
            final double maxHeight = residual[maxIdx];
            final double magnitude = Math.abs(maxHeight);

            if (magnitude <= settings.peakThreshold * std(residual)) break;
            if (!(magnitude > settings.minPeakHeight)) break;
            if (magnitude <= FitSettings.RESIDUAL_FLOOR * inputMagnitude) break;

            final double guessMean = positions[maxIdx];
            if (isSubtractionRinging(guesses, guessMean, magnitude)) {
                logger.debug("stop peak search: residual extreme {} at {} is left over from a subtraction", maxHeight, guessMean);
                break;
            }
            double guessStd;
            final int shortSide = halfHeightDistance(residual, maxIdx);
            if (shortSide > 0) {
                guessStd = computeGaussStd(shortSide * 2 * resolution);
            } else {
                // no half-height crossing on either side
                guessStd = 0.5 * (settings.peakWidthLimits[0] + settings.peakWidthLimits[1]);
            }
            if (guessStd < stdLimits[0]) guessStd = stdLimits[0];
            if (guessStd > stdLimits[1]) guessStd = stdLimits[1];

            final Bump guess = new Bump(guessMean, maxHeight, guessStd);
            logger.debug("candidate peak #{}: {}", guesses.size(), guess);
            guesses.add(guess);
            final double[] peakGauss = guess.evaluate(positions);
            for (int i = 0; i < residual.length; i++) {
                residual[i] -= peakGauss[i];
            }
        }
        return guesses;
    }

    /**
     * @return true if an earlier guess is within RINGING_STD_SPAN of its std from {@code position}
     * and at least 1 / RINGING_HEIGHT_FRACTION times higher than {@code magnitude}
     */
    static boolean isSubtractionRinging(final List<Bump> guesses, final double position, final double magnitude) {
        for (Bump g : guesses) {
            if (Math.abs(position - g.getMean()) <= FitSettings.RINGING_STD_SPAN * g.getStd()
                    && magnitude <= FitSettings.RINGING_HEIGHT_FRACTION * Math.abs(g.getHeight())) {
                return true;
            }
        }
        return false;
    }

    /**
     * Distance, in samples, from {@code peakIdx} to the closest half-height crossing on either side.
     * For a positive peak a crossing is a sample at or below half the peak value, for a negative peak
     * a sample at or above it.
     *
     * @return the shorter of the two distances, -1 if no crossing exists on either side
     */
    static int halfHeightDistance(final double[] values, final int peakIdx) {
        final double halfHeight = 0.5 * values[peakIdx];
        final boolean positive = values[peakIdx] >= 0;
        int left = -1;
        for (int i = peakIdx - 1; i >= 0; i--) {
            if (positive ? values[i] <= halfHeight : values[i] >= halfHeight) {
                left = peakIdx - i;
                break;
            }
        }
        int right = -1;
        for (int i = peakIdx + 1; i < values.length; i++) {
            if (positive ? values[i] <= halfHeight : values[i] >= halfHeight) {
                right = i - peakIdx;
                break;
            }
        }
        if (left < 0) return right;
        if (right < 0) return left;
        return Math.min(left, right);
    }

    /**
     * Drops guesses whose mean is within stdThreshold × std of either end of {@code range}.
     */
    public static List<Bump> dropEdgePeaks(final List<Bump> guesses,
                                           final double[] range,
                                           final double stdThreshold)
    {
        List<Bump> kept = new ArrayList<>(guesses.size());
        for (Bump g : guesses) {
            final double edgeDist = g.getStd() * stdThreshold;
            if (Math.abs(g.getMean() - range[0]) > edgeDist && Math.abs(g.getMean() - range[1]) > edgeDist) {
                kept.add(g);
            } else {
                logger.debug("drop guess too close to the edge: {}", g);
            }
        }
        return kept;
    }

    /**
     * Sorts guesses by mean and, for each pair of neighbors whose intervals
     * mean ± overlapThreshold × std intersect, drops the one with the lowest height.
     * Heights are compared as signed values. Pairs are evaluated on the sorted list
     * before any removal.
     */
    public static List<Bump> dropOverlappingPeaks(final List<Bump> guesses,
                                                  final double overlapThreshold)
    {
        List<Bump> sorted = new ArrayList<>(guesses);
        sorted.sort(Comparator.comparingDouble(Bump::getMean));

        // 1. flag guesses to be removed
        boolean[] drop = new boolean[sorted.size()];
        for (int i = 0; i < sorted.size() - 1; i++) {
            final Bump left = sorted.get(i);
            final Bump right = sorted.get(i + 1);
            final double leftUpper = left.getMean() + left.getStd() * overlapThreshold;
            final double rightLower = right.getMean() - right.getStd() * overlapThreshold;
            if (leftUpper > rightLower) {
                // first of the pair is dropped on equal heights
                final int lowest = right.getHeight() < left.getHeight() ? i + 1 : i;
                drop[lowest] = true;
            }
        }

        // 2. create a new list with the flagged guesses removed
        List<Bump> kept = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            if (drop[i]) logger.debug("drop overlapping guess: {}", sorted.get(i));
            else kept.add(sorted.get(i));
        }
        return kept;
    }
}
