package edu.mcmaster.erpshape;

/**
 * Parameters were requested from a result that holds no model.
 */
public class NoModelException extends ErpShapeException {

    public NoModelException(String message) {
        super(message);
    }
}
