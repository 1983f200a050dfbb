package org.dxworks.flowframe.model;

public class SourceLocation {
    public String filePath;
    public int line;     // 1-based
    public int column;   // 0-based
    public int endLine;
    public int endColumn;

    public SourceLocation() {
    }

    public SourceLocation(String filePath, int line, int column, int endLine, int endColumn) {
        this.filePath = filePath;
        this.line = line;
        this.column = column;
        this.endLine = endLine;
        this.endColumn = endColumn;
    }
}
