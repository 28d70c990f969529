package edu.mcmaster.erpshape;

import org.apache.commons.math3.exception.ConvergenceException;
import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.exception.TooManyIterationsException;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.util.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Joint least-squares fit of several Gaussian bumps against a signal, with every parameter kept
 * within {@link ClampParameters} bounds.
 */
public class MultiFit {
    public static final Logger logger = LoggerFactory.getLogger(MultiFit.class);

    private final double[] positions;
    private final double[] data;
    private final int maxEvaluations;

    private int evaluations = 0;

    //-------------------------------------------
    // Constructor
    //-------------------------------------------
    public MultiFit(final double[] positions, final double[] data, final int maxEvaluations) {
        assert(positions != null && data != null && positions.length == data.length);
        assert(maxEvaluations > 0);
        this.positions = positions;
        this.data = data;
        this.maxEvaluations = maxEvaluations;
    }

    // -------------------------------------------------
    // Public Interface
    //--------------------------------------------------

    /**
     * Fits all guesses together, starting from the guesses.
     *
     * @param guesses initial bumps, each within {@code bounds}
     * @param bounds bounds of the flattened parameter vector
     * @return fitted bumps, sorted by mean. Empty if there are no guesses, in which case the solver is not run
     * @throws FitException if the solver does not converge within the evaluation budget or hits a singularity
     */
    public List<Bump> fit(final List<Bump> guesses, final ClampParameters bounds) {
        if (guesses.isEmpty()) return new ArrayList<>();
        assert(bounds.getDimension() == guesses.size() * Bump.NPARAMS);
        final double[] start = bounds.clamp(Bump.flatten(guesses));
        final LeastSquaresProblem problem = new LeastSquaresBuilder()
                .model(getModel())
                .target(data)
                .start(start)
                .parameterValidator(bounds)
                .lazyEvaluation(false)
                .maxEvaluations(maxEvaluations)
                .maxIterations(maxEvaluations)
                .build();
        final LeastSquaresOptimizer.Optimum optimum;
        try {
            optimum = new LevenbergMarquardtOptimizer().optimize(problem);
        } catch (TooManyEvaluationsException | TooManyIterationsException ex) {
            throw new FitException("Model fitting failed due to not finding parameters in the peak component fit.", ex);
        } catch (ConvergenceException | SingularMatrixException | MathArithmeticException ex) {
            throw new FitException("Model fitting failed due to a numerical singularity during peak fitting. "
                    + "This can happen with settings that are too liberal, leading to a large number of guess peaks "
                    + "that cannot be fit together.", ex);
        }
        this.evaluations = optimum.getEvaluations();
        logger.debug("joint fit of {} peaks: {} evaluations, {} iterations, rms: {}",
                guesses.size(), optimum.getEvaluations(), optimum.getIterations(), optimum.getRMS());
        final double[] params = bounds.clamp(optimum.getPoint().toArray());
        for (double p : params) {
            if (!Double.isFinite(p)) throw new FitException("Model fitting yielded non-finite parameters.");
        }
        List<Bump> fitted = Bump.group(params);
        fitted.sort(Comparator.comparingDouble(Bump::getMean));
        return fitted;
    }

    public int getEvaluations() {
        return evaluations;
    }

    // -----------------------------------------------
    // Private Interface
    // -----------------------------------------------
    private MultivariateJacobianFunction getModel() {
        return (final RealVector point) -> {
            final double[] params = point.toArray();
            final RealVector value = new ArrayRealVector(GaussianFunction.sum(positions, params), false);
            final RealMatrix jacobian = new Array2DRowRealMatrix(positions.length, params.length);
            for (int i = 0; i < positions.length; i++) {
                jacobian.setRow(i, GaussianFunction.gradient(positions[i], params));
            }
            return new Pair<>(value, jacobian);
        };
    }
}
