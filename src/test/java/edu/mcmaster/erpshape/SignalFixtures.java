package edu.mcmaster.erpshape;

/**
 * Noise-free signals built from gaussian bumps, sampled every 0.1 over [0, 100].
 */
class SignalFixtures {
    static final double STEP = 0.1;
    static final int N = 1001;

    static double[] positions() {
        double[] pos = new double[N];
        for (int i = 0; i < N; i++) pos[i] = i * STEP;
        return pos;
    }

    /** bumps as (mean, height, std) triplets */
    static double[] bumps(double... params) {
        return GaussianFunction.sum(positions(), params);
    }
}
