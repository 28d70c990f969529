package edu.mcmaster.erpshape;

/**
 * The supplied signal is malformed: too short, unevenly spaced or holding non-finite values.
 */
public class DataException extends ErpShapeException {

    public DataException(String message) {
        super(message);
    }
}
