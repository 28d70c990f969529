package edu.mcmaster.erpshape;

/**
 * The joint least-squares fit of the peak guesses failed.
 */
public class FitException extends ErpShapeException {

    public FitException(String message) {
        super(message);
    }

    public FitException(String message, Throwable cause) {
        super(message, cause);
    }
}
