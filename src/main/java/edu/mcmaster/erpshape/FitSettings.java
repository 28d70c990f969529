package edu.mcmaster.erpshape;

/**
 * Settings of the peak model.
 * <ul>
 * <li>peakWidthLimits: limits on the two-sided peak width (2 × std), in position units</li>
 * <li>maxNPeaks: maximum number of peaks searched for</li>
 * <li>minPeakHeight: absolute height a candidate must exceed, in signal units</li>
 * <li>peakThreshold: relative height a candidate must exceed, in standard deviations of the residual</li>
 * <li>errorMetric: post-fit error measure</li>
 * <li>rectify: fit on |signal| instead of the signal</li>
 * <li>verbose: log warnings about settings and recovered fit failures</li>
 * </ul>
 * The remaining values are internal constants of the algorithm. maxEvaluations caps the number of model
 * evaluations of the least-squares solver.
 */
public class FitSettings {
    /** guesses closer than this many std to an edge of the range are dropped */
    public static final double EDGE_STD_THRESHOLD = 1.0;
    /** half-width, in std, of the interval used to detect overlapping guesses */
    public static final double GAUSS_OVERLAP_THRESHOLD = 0.75;
    /** the fitted mean may move this many times 2 × std away from its guess */
    public static final double CENTER_BOUND = 1.5;
    public static final int DEFAULT_MAX_EVALUATIONS = 500;
    /**
     * A residual extreme within RINGING_STD_SPAN std of an earlier guess, whose magnitude is at most
     * RINGING_HEIGHT_FRACTION of that guess height, is left over from subtracting the guess.
     */
    public static final double RINGING_STD_SPAN = 3.0;
    public static final double RINGING_HEIGHT_FRACTION = 0.1;
    /** peak search stops when the residual extreme falls to this fraction of the input extreme */
    public static final double RESIDUAL_FLOOR = 1e-9;

    public double[] peakWidthLimits = new double[]{0.5, 12.0};
    public int maxNPeaks = Integer.MAX_VALUE;
    public double minPeakHeight = 0.0;
    public double peakThreshold = 2.0;
    public ErrorMetric errorMetric = ErrorMetric.MAE;
    public boolean rectify = false;
    public boolean verbose = true;
    public int maxEvaluations = DEFAULT_MAX_EVALUATIONS;

    public FitSettings() {
    }

    public FitSettings(double minWidth, double maxWidth, int maxNPeaks, double peakThreshold, double minPeakHeight) {
        setPeakWidthLimits(minWidth, maxWidth)
                .setMaxNPeaks(maxNPeaks)
                .setPeakThreshold(peakThreshold)
                .setMinPeakHeight(minPeakHeight);
    }

    public FitSettings duplicate() {
        return new FitSettings()
                .setPeakWidthLimits(peakWidthLimits[0], peakWidthLimits[1])
                .setMaxNPeaks(maxNPeaks)
                .setMinPeakHeight(minPeakHeight)
                .setPeakThreshold(peakThreshold)
                .setErrorMetric(errorMetric)
                .setRectify(rectify)
                .setVerbose(verbose)
                .setMaxEvaluations(maxEvaluations);
    }

    public FitSettings setPeakWidthLimits(double minWidth, double maxWidth) {
        if (!(minWidth > 0) || !(maxWidth >= minWidth) || Double.isInfinite(maxWidth)) {
            throw new IllegalArgumentException("Invalid peak width limits: [" + minWidth + ", " + maxWidth + "]");
        }
        this.peakWidthLimits = new double[]{minWidth, maxWidth};
        return this;
    }

    public FitSettings setMaxNPeaks(int maxNPeaks) {
        if (maxNPeaks < 0) throw new IllegalArgumentException("maxNPeaks must be positive or zero");
        this.maxNPeaks = maxNPeaks;
        return this;
    }

    public FitSettings setMinPeakHeight(double minPeakHeight) {
        if (!(minPeakHeight >= 0)) throw new IllegalArgumentException("minPeakHeight must be positive or zero");
        this.minPeakHeight = minPeakHeight;
        return this;
    }

    public FitSettings setPeakThreshold(double peakThreshold) {
        if (!(peakThreshold >= 0)) throw new IllegalArgumentException("peakThreshold must be positive or zero");
        this.peakThreshold = peakThreshold;
        return this;
    }

    public FitSettings setErrorMetric(ErrorMetric errorMetric) {
        if (errorMetric == null) throw new IllegalArgumentException("errorMetric is null");
        this.errorMetric = errorMetric;
        return this;
    }

    public FitSettings setErrorMetric(String errorMetric) {
        return setErrorMetric(ErrorMetric.fromName(errorMetric));
    }

    public FitSettings setRectify(boolean rectify) {
        this.rectify = rectify;
        return this;
    }

    public FitSettings setVerbose(boolean verbose) {
        this.verbose = verbose;
        return this;
    }

    public FitSettings setMaxEvaluations(int maxEvaluations) {
        if (maxEvaluations < 1) throw new IllegalArgumentException("maxEvaluations must be at least 1");
        this.maxEvaluations = maxEvaluations;
        return this;
    }

    /**
     * @return limits of the gaussian std parameter, half of the two-sided width limits
     */
    public double[] getGaussStdLimits() {
        return new double[]{peakWidthLimits[0] / 2, peakWidthLimits[1] / 2};
    }

    @Override
    public String toString() {
        return String.format("FitSettings[widthLimits=[%s, %s], maxNPeaks=%s, minPeakHeight=%s, peakThreshold=%s, errorMetric=%s]",
                peakWidthLimits[0], peakWidthLimits[1], maxNPeaks == Integer.MAX_VALUE ? "inf" : maxNPeaks,
                minPeakHeight, peakThreshold, errorMetric);
    }
}
