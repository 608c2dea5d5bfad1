package com.gdin.inspection.cognify.storage;

import lombok.Data;

@Data
public class PersistReport {
    private int rowsChanged;
    private int rowsUnchanged;
    private int vectorsWritten;
    private int nodesWritten;
    private int edgesWritten;
    private int provenanceAdded;
    private int typeConflicts;

    public PersistReport add(PersistReport other) {
        rowsChanged += other.rowsChanged;
        rowsUnchanged += other.rowsUnchanged;
        vectorsWritten += other.vectorsWritten;
        nodesWritten += other.nodesWritten;
        edgesWritten += other.edgesWritten;
        provenanceAdded += other.provenanceAdded;
        typeConflicts += other.typeConflicts;
        return this;
    }

    /**
     * 本次写入没有改变任何一个库。
     */
    public boolean isNoop() {
        return rowsChanged == 0 && vectorsWritten == 0 && nodesWritten == 0 && edgesWritten == 0;
    }
}
