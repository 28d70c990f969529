package edu.mcmaster.erpshape;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Fits the same model independently on each signal of a group sharing the same positions.
 * Rows whose fit did not produce a model are stored as null.
 */
public class GroupFit {
    public static final Logger logger = LoggerFactory.getLogger(GroupFit.class);

    private final ModelResult[] results;

    private GroupFit(ModelResult[] results) {
        this.results = results;
    }

    public static GroupFit fit(final double[] positions, final double[][] values, final FitSettings settings) {
        return fit(positions, values, null, settings, new RunModes(), 1);
    }

    /**
     * @param values one signal per row, each as long as positions
     * @param nThreads number of worker threads; rows are fitted in the calling thread when 1
     * @throws NoDataException if positions or values are null or values holds no rows
     * @throws DataException if positions are unusable or a row does not match them in length
     * @throws FitException if a row fails and {@code modes.debug} is set
     */
    public static GroupFit fit(final double[] positions, final double[][] values, final double[] range,
                               final FitSettings settings, final RunModes modes, final int nThreads) {
        if (positions == null || values == null || values.length == 0) {
            throw new NoDataException("No data available to fit, can not proceed.");
        }
        if (nThreads < 1) throw new IllegalArgumentException("nThreads must be at least 1, got " + nThreads);
        for (int i = 0; i < values.length; i++) {
            if (values[i] == null || values[i].length != positions.length) {
                throw new InconsistentDataException("Signal " + i + " does not match the positions in size: "
                        + (values[i] == null ? "null" : values[i].length) + " vs " + positions.length);
            }
        }
        // shared positions are validated once, before any worker starts
        Signal.of(positions, new double[positions.length], range, modes.duplicate().setCheckData(false));

        final ErpModel model = new ErpModel(settings);
        if (settings.verbose) logger.info("Running group fit across {} signals", values.length);
        final ModelResult[] results = new ModelResult[values.length];
        final ErpShapeException[] errors = new ErpShapeException[values.length];
        if (nThreads == 1) {
            for (int i = 0; i < values.length; i++) fitRow(model, positions, values, range, modes, i, results, errors);
        } else {
            ExecutorService executor = Executors.newFixedThreadPool(nThreads);
            try {
                CompletionService<Integer> completion = new ExecutorCompletionService<>(executor);
                for (int i = 0; i < values.length; i++) {
                    final int idx = i;
                    completion.submit(() -> {
                        fitRow(model, positions, values, range, modes.duplicate(), idx, results, errors);
                        return idx;
                    });
                }
                for (int i = 0; i < values.length; i++) {
                    try {
                        completion.take().get();
                    } catch (ExecutionException e) {
                        // row errors are caught by the worker: anything else is a bug
                        if (e.getCause() instanceof RuntimeException) throw (RuntimeException) e.getCause();
                        if (e.getCause() instanceof Error) throw (Error) e.getCause();
                        throw new ErpShapeException("Group fit worker failed", e.getCause());
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new ErpShapeException("Group fit interrupted", e);
                    }
                }
            } finally {
                executor.shutdownNow();
            }
        }
        if (modes.debug) {
            for (ErpShapeException e : errors) {
                if (e != null) throw e;
            }
        }
        return new GroupFit(results);
    }

    /**
     * Fits row {@code idx} into {@code results}. A row without model is left null; a row raising an
     * {@link ErpShapeException} is left null and its error kept in {@code errors}.
     */
    private static void fitRow(ErpModel model, double[] positions, double[][] values, double[] range, RunModes modes,
                               int idx, ModelResult[] results, ErpShapeException[] errors) {
        try {
            ModelResult res = model.fit(positions, values[idx], range, modes);
            results[idx] = res.hasModel() ? res : null;
        } catch (ErpShapeException e) {
            logger.warn("Fit of signal {} failed: {}", idx, e.getMessage());
            errors[idx] = e;
        }
    }

    public int size() {
        return results.length;
    }

    /** result of each row, null where the fit failed or was cleaned out */
    public ModelResult[] getResults() {
        return results.clone();
    }

    public ModelResult getResult(int row) {
        return results[row];
    }

    public int getNNull() {
        int n = 0;
        for (ModelResult r : results) if (r == null) n++;
        return n;
    }

    public int[] getNullIndices() {
        int[] idx = new int[getNNull()];
        int j = 0;
        for (int i = 0; i < results.length; i++) if (results[i] == null) idx[j++] = i;
        return idx;
    }

    /** number of peaks per row, null for null rows */
    public Integer[] getNPeaks() {
        Integer[] n = new Integer[results.length];
        for (int i = 0; i < results.length; i++) n[i] = results[i] == null ? null : results[i].getNPeaks();
        return n;
    }

    /**
     * Table parameters are stacked over non-null rows, with a trailing column holding the row index.
     * Scalar parameters give one row per signal, NaN for null rows.
     */
    public double[][] getParams(ParamType type) {
        if (!type.isTable()) {
            double[][] res = new double[results.length][];
            for (int i = 0; i < results.length; i++) {
                res[i] = new double[]{results[i] == null ? Double.NaN : results[i].getScalar(type)};
            }
            return res;
        }
        List<double[]> rows = new ArrayList<>();
        for (int i = 0; i < results.length; i++) {
            if (results[i] == null) continue;
            for (double[] r : results[i].getParams(type)) {
                double[] row = Arrays.copyOf(r, r.length + 1);
                row[r.length] = i;
                rows.add(row);
            }
        }
        return rows.toArray(new double[0][]);
    }

    /**
     * One column of a table stacked over non-null rows, or one scalar per row.
     */
    public double[] getParams(ParamType type, String column) {
        if (!type.isTable()) return column(getParams(type), 0);
        return column(getParams(type), type.columnIndex(column));
    }

    private static double[] column(double[][] table, int col) {
        double[] res = new double[table.length];
        for (int i = 0; i < table.length; i++) res[i] = table[i][col];
        return res;
    }

    /**
     * Sets to null the rows fitting worse than the cutoffs. A NaN cutoff disables its criterion.
     *
     * @return number of rows nulled out
     */
    public int clean(final double rSquaredCutoff, final double errorCutoff) {
        int count = 0;
        for (int i = 0; i < results.length; i++) {
            if (results[i] == null) continue;
            boolean drop = !Double.isNaN(rSquaredCutoff) && results[i].getRSquared() < rSquaredCutoff;
            drop |= !Double.isNaN(errorCutoff) && results[i].getError() > errorCutoff;
            if (drop) {
                results[i] = null;
                count++;
            }
        }
        if (count > 0) logger.debug("cleaned {} of {} signals", count, results.length);
        return count;
    }
}
