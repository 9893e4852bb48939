package com.gemflow.ast;

/**
 * 源码位置信息（起止行列，行列均从 1 开始，结束列不含）
 */
public final class SourceLocation {
    private final String file;
    private final int line;
    private final int column;
    private final int endLine;
    private final int endColumn;

    public SourceLocation(String file, int line, int column, int endLine, int endColumn) {
        this.file = file != null ? file.intern() : null;
        this.line = line;
        this.column = column;
        this.endLine = endLine;
        this.endColumn = endColumn;
    }

    public static SourceLocation of(String file, int line, int column, int endLine, int endColumn) {
        return new SourceLocation(file, line, column, endLine, endColumn);
    }

    public String getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public int getEndLine() {
        return endLine;
    }

    public int getEndColumn() {
        return endColumn;
    }

    /** 当前位置是否完整覆盖 other */
    public boolean contains(SourceLocation other) {
        if (other == null) return false;
        if (file != null && !file.equals(other.file)) return false;
        boolean startsBefore = line < other.line || (line == other.line && column <= other.column);
        boolean endsAfter = endLine > other.endLine || (endLine == other.endLine && endColumn >= other.endColumn);
        return startsBefore && endsAfter;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceLocation)) return false;
        SourceLocation that = (SourceLocation) o;
        return line == that.line && column == that.column
                && endLine == that.endLine && endColumn == that.endColumn
                && (file == null ? that.file == null : file.equals(that.file));
    }

    @Override
    public int hashCode() {
        int h = file != null ? file.hashCode() : 0;
        h = 31 * h + line;
        h = 31 * h + column;
        h = 31 * h + endLine;
        h = 31 * h + endColumn;
        return h;
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + column + "-" + endLine + ":" + endColumn;
    }
}
