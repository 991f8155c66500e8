package com.kpi.drivertree.exception;

public class CategoryNotFoundException extends DriverTreeException {

    public CategoryNotFoundException(String treeType, String kpi) {
        super(ErrorKind.NOT_FOUND, String.format("No formulas found for tree type '%s' and KPI '%s'", treeType, kpi));
    }
}
