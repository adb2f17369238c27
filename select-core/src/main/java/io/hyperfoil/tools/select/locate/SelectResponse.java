package io.hyperfoil.tools.select.locate;

import java.util.List;

/**
 * The answer to a {@link SelectRequest}.
 * The four position fields are either all set, cursor at the start of the found object and
 * anchor at its last character, or all null when nothing was found. The status is always set.
 */
public class SelectResponse {

    public static final String STATUS_DONE = "done";

    private final Integer cursorLine;
    private final Integer cursorColumn;
    private final Integer anchorLine;
    private final Integer anchorColumn;
    private final List<String> status;

    private SelectResponse(Integer cursorLine, Integer cursorColumn, Integer anchorLine, Integer anchorColumn) {
        this.cursorLine = cursorLine;
        this.cursorColumn = cursorColumn;
        this.anchorLine = anchorLine;
        this.anchorColumn = anchorColumn;
        this.status = List.of(STATUS_DONE);
    }

    public static SelectResponse empty() {
        return new SelectResponse(null, null, null, null);
    }

    public static SelectResponse of(Extent extent) {
        return new SelectResponse(
                extent.getStart().getLine(),
                extent.getStart().getColumn(),
                extent.getEnd().getLine(),
                extent.getEnd().getColumn());
    }

    public boolean isFound() {
        return cursorLine != null;
    }

    public Integer getCursorLine() {
        return cursorLine;
    }

    public Integer getCursorColumn() {
        return cursorColumn;
    }

    public Integer getAnchorLine() {
        return anchorLine;
    }

    public Integer getAnchorColumn() {
        return anchorColumn;
    }

    public List<String> getStatus() {
        return status;
    }

    @Override
    public String toString() {
        if (!isFound()) {
            return "nothing " + status;
        }
        return cursorLine + ":" + cursorColumn + "-" + anchorLine + ":" + anchorColumn + " " + status;
    }
}
