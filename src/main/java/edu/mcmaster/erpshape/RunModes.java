package edu.mcmaster.erpshape;

/**
 * Per-call switches controlling data checks and error propagation.
 */
public class RunModes {
    /** when set, a failed fit throws {@link FitException} instead of returning an empty result */
    public boolean debug = false;
    /** reject unevenly spaced positions */
    public boolean checkTimes = true;
    /** reject NaN / infinite values */
    public boolean checkData = true;

    public RunModes setDebug(boolean debug) {
        this.debug = debug;
        return this;
    }

    public RunModes setCheckTimes(boolean checkTimes) {
        this.checkTimes = checkTimes;
        return this;
    }

    public RunModes setCheckData(boolean checkData) {
        this.checkData = checkData;
        return this;
    }

    public RunModes duplicate() {
        return new RunModes().setDebug(debug).setCheckTimes(checkTimes).setCheckData(checkData);
    }
}
