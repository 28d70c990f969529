package edu.mcmaster.erpshape;

/**
 * Everything known about one fitted peak: the gaussian parameters, the reported peak parameters
 * and the shape descriptors. Keeping them in one record keeps the three result tables aligned
 * when peaks are dropped.
 */
public class FitPeak {

    private final Bump bump;
    private PeakParams peakParams;
    private ShapeParams shapeParams;
    private PeakStatus status;

    public FitPeak(Bump bump) {
        this.bump = bump;
        this.status = PeakStatus.FITTED;
    }

    public Bump getBump() {
        return bump;
    }

    public PeakParams getPeakParams() {
        return peakParams;
    }

    public void setPeakParams(PeakParams peakParams) {
        this.peakParams = peakParams;
    }

    public ShapeParams getShapeParams() {
        return shapeParams;
    }

    public void setShapeParams(ShapeParams shapeParams) {
        this.shapeParams = shapeParams;
        this.status = shapeParams.isResolved() ? PeakStatus.CONVERGED : PeakStatus.BADPEAK;
    }

    public boolean hasStatus(PeakStatus s) {
        return this.status == s;
    }

    public PeakStatus getStatus() {
        return status;
    }

    @Override
    public String toString() {
        return "FitPeak[" + status + ", " + bump + ", " + peakParams + ", " + shapeParams + "]";
    }
}
