package edu.mcmaster.erpshape;

/**
 * Positions and values of a signal do not have the same length.
 */
public class InconsistentDataException extends DataException {

    public InconsistentDataException(String message) {
        super(message);
    }
}
