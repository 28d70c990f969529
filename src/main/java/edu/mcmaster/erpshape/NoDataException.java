package edu.mcmaster.erpshape;

/**
 * A fit was requested but no signal was supplied.
 */
public class NoDataException extends ErpShapeException {

    public NoDataException(String message) {
        super(message);
    }
}
