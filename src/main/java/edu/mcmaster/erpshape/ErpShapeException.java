package edu.mcmaster.erpshape;

/**
 * Base class for errors raised while preparing data for, or fitting, a peak model.
 */
public class ErpShapeException extends RuntimeException {

    public ErpShapeException(String message) {
        super(message);
    }

    public ErpShapeException(String message, Throwable cause) {
        super(message, cause);
    }
}
