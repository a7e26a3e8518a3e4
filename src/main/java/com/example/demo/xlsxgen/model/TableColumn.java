package com.example.demo.xlsxgen.model;

import lombok.Getter;

/**
 * Per-column options of a worksheet table: the header caption, a
 * calculated column formula and the total row label or function.
 */
@Getter
public class TableColumn {
    private String header = "";
    private String formula = "";
    private String totalLabel = "";
    private TableFunction totalFunction = TableFunction.NONE;

    public TableColumn setHeader(String header) {
        this.header = header;
        return this;
    }

    /**
     * Sets a formula applied to every data row of the column. The
     * {@code @} shorthand for the current row, as in
     * {@code SUM(Table1[@[Q1]:[Q4]])}, is expanded to {@code [#This Row],}.
     */
    public TableColumn setFormula(String formula) {
        String stripped = formula.startsWith("=") ? formula.substring(1) : formula;
        this.formula = stripped.replace("@", "[#This Row],");
        return this;
    }

    public TableColumn setTotalLabel(String totalLabel) {
        this.totalLabel = totalLabel;
        return this;
    }

    public TableColumn setTotalFunction(TableFunction totalFunction) {
        this.totalFunction = totalFunction;
        return this;
    }

    public boolean hasFormula() {
        return !formula.isEmpty();
    }

    TableColumn copy() {
        TableColumn copy = new TableColumn();
        copy.header = header;
        copy.formula = formula;
        copy.totalLabel = totalLabel;
        copy.totalFunction = totalFunction;
        return copy;
    }
}
