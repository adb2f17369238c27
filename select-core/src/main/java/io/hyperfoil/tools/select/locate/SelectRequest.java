package io.hyperfoil.tools.select.locate;

/**
 * What an editor asks for: the kind of object, the whole source, its current selection and
 * optionally how many times to grow it and whether to select inside the object.
 * Lines and columns are ones-based. Without an anchor the selection is a caret at the cursor.
 */
public class SelectRequest {

    private String kind;
    private String code;
    private Integer cursorLine;
    private Integer cursorColumn;
    private Integer anchorLine;
    private Integer anchorColumn;
    private Integer count;
    private String extent;

    public SelectRequest() {
    }

    public SelectRequest(String kind, String code, int cursorLine, int cursorColumn) {
        this.kind = kind;
        this.code = code;
        this.cursorLine = cursorLine;
        this.cursorColumn = cursorColumn;
    }

    public String getKind() {
        return kind;
    }

    public void setKind(String kind) {
        this.kind = kind;
    }

    public String getCode() {
        return code;
    }

    public void setCode(String code) {
        this.code = code;
    }

    public Integer getCursorLine() {
        return cursorLine;
    }

    public void setCursorLine(Integer cursorLine) {
        this.cursorLine = cursorLine;
    }

    public Integer getCursorColumn() {
        return cursorColumn;
    }

    public void setCursorColumn(Integer cursorColumn) {
        this.cursorColumn = cursorColumn;
    }

    public Integer getAnchorLine() {
        return anchorLine;
    }

    public void setAnchorLine(Integer anchorLine) {
        this.anchorLine = anchorLine;
    }

    public Integer getAnchorColumn() {
        return anchorColumn;
    }

    public void setAnchorColumn(Integer anchorColumn) {
        this.anchorColumn = anchorColumn;
    }

    public SelectRequest anchor(int line, int column) {
        this.anchorLine = line;
        this.anchorColumn = column;
        return this;
    }

    public Integer getCount() {
        return count;
    }

    public void setCount(Integer count) {
        this.count = count;
    }

    public String getExtent() {
        return extent;
    }

    public void setExtent(String extent) {
        this.extent = extent;
    }

    public boolean hasAnchor() {
        return anchorLine != null && anchorColumn != null;
    }

    @Override
    public String toString() {
        return "select " + kind + " cursor=" + cursorLine + ":" + cursorColumn
                + (hasAnchor() ? " anchor=" + anchorLine + ":" + anchorColumn : "")
                + " count=" + count + " extent=" + extent;
    }
}
