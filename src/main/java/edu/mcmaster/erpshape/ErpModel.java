package edu.mcmaster.erpshape;

import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Models a signal (an event-related response or a spectrum) as a sum of Gaussian peaks.
 * <p>
 * Peaks are searched greedily on a copy of the signal, guesses too close to the edges or overlapping
 * a higher guess are dropped, the remaining ones are fitted jointly on the signal, and each fitted peak
 * is described by its shape between its half-magnitude crossings. Peaks whose crossings can not be found
 * are dropped.
 * <p>
 * A model holds no mutable state: concurrent fits may share one instance.
 */
public class ErpModel {
    public static final Logger logger = LoggerFactory.getLogger(ErpModel.class);

    private final FitSettings settings;

    public ErpModel() {
        this(new FitSettings());
    }

    public ErpModel(FitSettings settings) {
        this.settings = settings.duplicate();
    }

    public FitSettings getSettings() {
        return settings.duplicate();
    }

    public ModelResult fit(final double[] positions, final double[] values) {
        return fit(positions, values, null, new RunModes());
    }

    public ModelResult fit(final double[] positions, final double[] values, final double[] range, final RunModes modes) {
        return fit(Signal.of(positions, values, range, modes), modes);
    }

    /**
     * Fits the model on {@code signal}.
     *
     * @return the result, empty if the fit failed and {@code modes.debug} is not set
     * @throws NoDataException if signal is null
     * @throws FitException if the fit failed and {@code modes.debug} is set
     */
    public ModelResult fit(final Signal signal, final RunModes modes) {
        if (signal == null) throw new NoDataException("No data available to fit, can not proceed.");
        if (settings.verbose) checkWidthLimits(signal);
        try {
            // data were not checked when added: non-finite values would make the solver yield NaNs
            if (!modes.checkData && signal.hasNonFiniteValues()) {
                throw new FitException("Model fitting was skipped because there are NaN or Inf values in the data, "
                        + "which preclude model fitting.");
            }
            final Signal fitSignal = settings.rectify ? signal.rectified() : signal;
            final double[] positions = fitSignal.getPositions();
            final double[] values = fitSignal.getValues();

            List<Bump> bumps = fitPeaks(fitSignal);
            List<FitPeak> peaks = ShapeMeasurements.measure(fitSignal, bumps, FitSettings.GAUSS_OVERLAP_THRESHOLD);
            peaks = ShapeMeasurements.dropUnresolvedPeaks(peaks);
            final double[] peakFit = GaussianFunction.sum(positions, Bump.flatten(bumpsOf(peaks)));
            return ModelResult.of(peaks, computeRSquared(values, peakFit), settings.errorMetric.compute(values, peakFit));
        } catch (FitException e) {
            if (modes.debug) throw e;
            if (settings.verbose) logger.warn("Model fitting was unsuccessful: {}", e.getMessage());
            return ModelResult.empty();
        }
    }

    /**
     * Guess search, edge and overlap rejection and joint fit.
     *
     * @return fitted bumps sorted by mean
     */
    List<Bump> fitPeaks(final Signal signal) {
        final double[] positions = signal.getPositions();
        List<Bump> guesses = Util.findPeakGuesses(positions, signal.getValues(), signal.getResolution(), settings);
        guesses = Util.dropEdgePeaks(guesses, signal.getRange(), FitSettings.EDGE_STD_THRESHOLD);
        guesses = Util.dropOverlappingPeaks(guesses, FitSettings.GAUSS_OVERLAP_THRESHOLD);
        if (guesses.isEmpty()) return guesses;
        ClampParameters bounds = ClampParameters.forGuesses(guesses, settings.getGaussStdLimits(),
                signal.getRange(), FitSettings.CENTER_BOUND);
        return new MultiFit(positions, signal.getValues(), settings.maxEvaluations).fit(guesses, bounds);
    }

    private static List<Bump> bumpsOf(final List<FitPeak> peaks) {
        List<Bump> bumps = new ArrayList<>(peaks.size());
        for (FitPeak p : peaks) bumps.add(p.getBump());
        return bumps;
    }

    /**
     * Squared Pearson correlation between data and model. NaN when either is constant.
     */
    public static double computeRSquared(final double[] data, final double[] model) {
        if (data.length < 2 || isConstant(data) || isConstant(model)) return Double.NaN;
        final double r = new PearsonsCorrelation().correlation(data, model);
        return r * r;
    }

    private static boolean isConstant(final double[] values) {
        for (int i = 1; i < values.length; i++) {
            if (values[i] != values[0]) return false;
        }
        return true;
    }

    private void checkWidthLimits(final Signal signal) {
        if (1.5 * signal.getResolution() >= settings.peakWidthLimits[0]) {
            logger.warn("The lower peak width limit ({}) is close to or below the sampling resolution ({}). "
                    + "Fitting may be unstable, consider a lower limit well above the resolution.",
                    settings.peakWidthLimits[0], signal.getResolution());
        }
    }
}
