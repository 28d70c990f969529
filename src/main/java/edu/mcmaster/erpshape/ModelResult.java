package edu.mcmaster.erpshape;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of a fit: the accepted peaks and the goodness of fit.
 * A result holds a model when at least one peak was accepted. A fit that completed without any peak
 * keeps its scores against the flat zero curve; a fit that did not complete has NaN scores.
 */
public class ModelResult {

    private final List<FitPeak> peaks;
    private final double rSquared;
    private final double error;
    private final boolean hasModel;

    private ModelResult(List<FitPeak> peaks, double rSquared, double error, boolean hasModel) {
        this.peaks = Collections.unmodifiableList(new ArrayList<>(peaks));
        this.rSquared = rSquared;
        this.error = error;
        this.hasModel = hasModel;
    }

    public static ModelResult empty() {
        return new ModelResult(Collections.emptyList(), Double.NaN, Double.NaN, false);
    }

    public static ModelResult of(List<FitPeak> peaks, double rSquared, double error) {
        for (FitPeak p : peaks) {
            if (!p.hasStatus(PeakStatus.CONVERGED)) throw new IllegalArgumentException("peak with unresolved shape: " + p);
        }
        return new ModelResult(peaks, rSquared, error, !peaks.isEmpty());
    }

    public boolean hasModel() {
        return hasModel;
    }

    public List<FitPeak> getPeaks() {
        return peaks;
    }

    public int getNPeaks() {
        return peaks.size();
    }

    public double getRSquared() {
        return rSquared;
    }

    public double getError() {
        return error;
    }

    public List<Bump> getBumps() {
        List<Bump> bumps = new ArrayList<>(peaks.size());
        for (FitPeak p : peaks) bumps.add(p.getBump());
        return bumps;
    }

    /** rows of [mean, height, std] */
    public double[][] getGaussianParams() {
        double[][] res = new double[peaks.size()][];
        for (int i = 0; i < res.length; i++) res[i] = peaks.get(i).getBump().getParameterArray();
        return res;
    }

    /** rows of [center, power, bandwidth] */
    public double[][] getPeakParams() {
        double[][] res = new double[peaks.size()][];
        for (int i = 0; i < res.length; i++) res[i] = peaks.get(i).getPeakParams().toArray();
        return res;
    }

    /** rows of the seven shape descriptors */
    public double[][] getShapeParams() {
        double[][] res = new double[peaks.size()][];
        for (int i = 0; i < res.length; i++) res[i] = peaks.get(i).getShapeParams().toArray();
        return res;
    }

    /** rows of [start, peak, end] sample indices */
    public int[][] getCrossingIndices() {
        int[][] res = new int[peaks.size()][];
        for (int i = 0; i < res.length; i++) {
            ShapeParams s = peaks.get(i).getShapeParams();
            res[i] = new int[]{s.getStartIdx(), s.getPeakIdx(), s.getEndIdx()};
        }
        return res;
    }

    public double[][] getTable(ParamType type) {
        switch (type) {
            case PEAK:
                return getPeakParams();
            case GAUSSIAN:
                return getGaussianParams();
            case SHAPE:
                return getShapeParams();
            default:
                throw new IllegalArgumentException(type + " is not a parameter table");
        }
    }

    /**
     * Parameters of a table, as rows, or a scalar as a single cell.
     *
     * @throws NoModelException if this result holds no model
     */
    public double[][] getParams(ParamType type) {
        if (!hasModel) throw new NoModelException("No model fit results are available to extract, can not proceed.");
        if (!type.isTable()) return new double[][]{{getScalar(type)}};
        return getTable(type);
    }

    /**
     * One column of a table, one value per peak.
     */
    public double[] getParams(ParamType type, String column) {
        return getParams(type, type.columnIndex(column));
    }

    public double[] getParams(ParamType type, int column) {
        type.checkColumn(column);
        double[][] table = getParams(type);
        double[] res = new double[table.length];
        for (int i = 0; i < table.length; i++) res[i] = table[i][column];
        return res;
    }

    public double getScalar(ParamType type) {
        switch (type) {
            case R_SQUARED:
                return rSquared;
            case ERROR:
                return error;
            default:
                throw new IllegalArgumentException(type + " is not a scalar");
        }
    }

    /**
     * Sum of the fitted bumps evaluated at {@code positions}; flat zero without peaks.
     */
    public double[] regenerate(final double[] positions) {
        return GaussianFunction.sum(positions, Bump.flatten(getBumps()));
    }

    /**
     * Absolute difference between the signal and the model, sample by sample.
     */
    public double[] pointwiseError(final Signal signal) {
        if (!hasModel) throw new NoModelException("No model is available to compute errors with.");
        final double[] model = regenerate(signal.getPositions());
        double[] errors = new double[model.length];
        for (int i = 0; i < model.length; i++) errors[i] = Math.abs(signal.getValue(i) - model[i]);
        return errors;
    }

    @Override
    public String toString() {
        if (!hasModel) return "ModelResult[no model]";
        return String.format("ModelResult[%d peaks, r²=%.4f, error=%.4g]", peaks.size(), rSquared, error);
    }
}
