package edu.mcmaster.erpshape;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Parameter tables of a model result and the names of their columns.
 */
public enum ParamType {
    /** [CT, PW, BW]: center, signal value and two-sided width of each peak */
    PEAK("CT", "PW", "BW"),
    /** [MN, HT, SD]: mean, height and std of each fitted gaussian */
    GAUSSIAN("MN", "HT", "SD"),
    SHAPE("FWHM", "rise_time", "decay_time", "symmetry", "sharpness", "sharpness_rise", "sharpness_decay"),
    R_SQUARED,
    ERROR;

    private final List<String> columns;

    ParamType(String... columns) {
        this.columns = Collections.unmodifiableList(Arrays.asList(columns));
    }

    public List<String> getColumns() {
        return columns;
    }

    public boolean isTable() {
        return !columns.isEmpty();
    }

    /**
     * @throws IllegalArgumentException if this type has no such column
     */
    public int columnIndex(String column) {
        int idx = columns.indexOf(column);
        if (idx < 0) throw new IllegalArgumentException("Unknown column '" + column + "' for " + this + ", expected one of " + columns);
        return idx;
    }

    public void checkColumn(int column) {
        if (column < 0 || column >= columns.size()) {
            throw new IllegalArgumentException("Column index " + column + " not valid for " + this);
        }
    }
}
