package edu.mcmaster.erpshape;

import java.util.Locale;

/**
 * Post-fit error between the data and the model. This is not the objective minimised by the
 * solver, only a summary of the final fit.
 */
public enum ErrorMetric {
    /** mean absolute error */
    MAE {
        @Override
        public double compute(final double[] data, final double[] model) {
            checkLengths(data, model);
            double sum = 0.0;
            for (int i = 0; i < data.length; i++) {
                sum += Math.abs(data[i] - model[i]);
            }
            return sum / data.length;
        }
    },
    /** mean squared error */
    MSE {
        @Override
        public double compute(final double[] data, final double[] model) {
            checkLengths(data, model);
            double sum = 0.0;
            for (int i = 0; i < data.length; i++) {
                final double d = data[i] - model[i];
                sum += d * d;
            }
            return sum / data.length;
        }
    },
    /** root mean squared error */
    RMSE {
        @Override
        public double compute(final double[] data, final double[] model) {
            return Math.sqrt(MSE.compute(data, model));
        }
    };

    public abstract double compute(double[] data, double[] model);

    /**
     * Looks a metric up by name, ignoring case.
     *
     * @throws IllegalArgumentException if the name is not one of MAE, MSE, RMSE
     */
    public static ErrorMetric fromName(final String name) {
        if (name == null) throw new IllegalArgumentException("Error metric name is null");
        for (ErrorMetric m : values()) {
            if (m.name().equals(name.toUpperCase(Locale.ROOT))) return m;
        }
        throw new IllegalArgumentException("Error metric '" + name + "' not understood or not implemented.");
    }

    private static void checkLengths(final double[] data, final double[] model) {
        if (data.length != model.length) {
            throw new IllegalArgumentException("data and model differ in length: " + data.length + " vs " + model.length);
        }
    }
}
