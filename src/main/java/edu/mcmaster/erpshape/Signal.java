package edu.mcmaster.erpshape;

import java.util.Arrays;

/**
 * Evenly sampled signal restricted to the range it is fitted on. Positions and values are private
 * copies of the caller's arrays.
 */
public class Signal {
    private static final double SPACING_RTOL = 1e-5;
    private static final double SPACING_ATOL = 1e-8;

    private final double[] positions;
    private final double[] values;
    private final double[] range;
    private final double resolution;

    private Signal(double[] positions, double[] values) {
        this.positions = positions;
        this.values = values;
        this.range = new double[]{Arrays.stream(positions).min().getAsDouble(), Arrays.stream(positions).max().getAsDouble()};
        this.resolution = Math.abs(positions[1] - positions[0]);
    }

    public static Signal of(final double[] positions, final double[] values) {
        return of(positions, values, null, new RunModes());
    }

    public static Signal of(final double[] positions, final double[] values, final double[] range) {
        return of(positions, values, range, new RunModes());
    }

    /**
     * Validates and copies data.
     *
     * @param positions sample positions (time or frequency), evenly spaced
     * @param values signal values
     * @param range inclusive [lo, hi] range to restrict the signal to, null keeps the whole signal
     * @param modes controls the spacing and finiteness checks
     * @throws NoDataException if positions or values are null
     * @throws InconsistentDataException if positions and values differ in length
     * @throws DataException if the data are otherwise unusable
     */
    public static Signal of(final double[] positions, final double[] values, final double[] range, final RunModes modes) {
        if (positions == null || values == null) throw new NoDataException("No data available to fit, can not proceed.");
        if (positions.length != values.length) {
            throw new InconsistentDataException("The input positions and signal values are not a consistent size: "
                    + positions.length + " vs " + values.length);
        }
        double[] pos = positions;
        double[] val = values;
        if (range != null) {
            if (range.length != 2 || !(range[0] <= range[1])) throw new DataException("Invalid range: " + Arrays.toString(range));
            int count = 0;
            for (double p : positions) if (p >= range[0] && p <= range[1]) count++;
            pos = new double[count];
            val = new double[count];
            int j = 0;
            for (int i = 0; i < positions.length; i++) {
                if (positions[i] >= range[0] && positions[i] <= range[1]) {
                    pos[j] = positions[i];
                    val[j] = values[i];
                    j++;
                }
            }
        } else {
            pos = positions.clone();
            val = values.clone();
        }
        if (pos.length < 2) throw new DataException("At least 2 samples are required, got " + pos.length);
        for (double p : pos) {
            if (!Double.isFinite(p)) throw new DataException("The input positions contain NaNs or Infs.");
        }
        if (modes.checkTimes) {
            final double res = Math.abs(pos[1] - pos[0]);
            for (int i = 1; i < pos.length; i++) {
                final double diff = pos[i] - pos[i - 1];
                if (Math.abs(diff - res) > SPACING_ATOL + SPACING_RTOL * Math.abs(res)) {
                    throw new DataException("The input positions are not evenly spaced. "
                            + "The model expects equidistant positions.");
                }
            }
        }
        if (modes.checkData) {
            for (int i = 0; i < val.length; i++) {
                if (!Double.isFinite(val[i])) {
                    throw new DataException("The input data contains NaNs or Infs (" + val[i] + " at sample " + i
                            + "). This will cause the fitting to yield NaNs.");
                }
            }
        }
        return new Signal(pos, val);
    }

    public double[] getPositions() {
        return positions.clone();
    }

    public double[] getValues() {
        return values.clone();
    }

    public int size() {
        return positions.length;
    }

    public double getPosition(int idx) {
        return positions[idx];
    }

    public double getValue(int idx) {
        return values[idx];
    }

    public double[] getRange() {
        return range.clone();
    }

    public double getResolution() {
        return resolution;
    }

    public double getSamplingRate() {
        return 1 / resolution;
    }

    public boolean hasNonFiniteValues() {
        for (double v : values) if (!Double.isFinite(v)) return true;
        return false;
    }

    /**
     * @return a signal over the same positions with absolute values
     */
    public Signal rectified() {
        double[] abs = new double[values.length];
        for (int i = 0; i < values.length; i++) abs[i] = Math.abs(values[i]);
        return new Signal(positions, abs);
    }

    /**
     * @return index of the sample closest to {@code position}, the first one on ties
     */
    public int nearestIndex(final double position) {
        int best = 0;
        double bestDist = Math.abs(positions[0] - position);
        for (int i = 1; i < positions.length; i++) {
            final double d = Math.abs(positions[i] - position);
            if (d < bestDist) {
                bestDist = d;
                best = i;
            }
        }
        return best;
    }
}
