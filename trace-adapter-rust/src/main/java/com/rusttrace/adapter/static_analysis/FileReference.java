package com.rusttrace.adapter.static_analysis;

/**
 * Location of a traced item in a source file.
 * Line and column start out as an approximation and are corrected once the item's keyword is seen.
 */
public class FileReference {

    private final String filename;
    private Integer line;
    private Integer column;

    public FileReference(String filename, Integer line, Integer column) {
        this.filename = filename;
        this.line = line;
        this.column = column;
    }

    /** A reference with no position, used for nodes that are never emitted. */
    public static FileReference unpositioned(String filename) {
        return new FileReference(filename, null, null);
    }

    public void setPosition(Integer line, Integer column) {
        this.line = line;
        this.column = column;
    }

    public String getFilename() { return filename; }
    public Integer getLine()    { return line; }
    public Integer getColumn()  { return column; }

    @Override
    public String toString() {
        return filename + ":" + line + ":" + column;
    }
}
