package io.hyperfoil.tools.select.lsp;

import com.google.gson.annotations.SerializedName;
import io.hyperfoil.tools.select.locate.SelectResponse;

import java.util.List;

/**
 * Result of {@code lisp/select}. The position fields are left out of the JSON when nothing was
 * found; {@code status} is always {@code ["done"]}.
 */
public class SelectResult {

    @SerializedName("cursor-line")
    private Integer cursorLine;
    @SerializedName("cursor-column")
    private Integer cursorColumn;
    @SerializedName("anchor-line")
    private Integer anchorLine;
    @SerializedName("anchor-column")
    private Integer anchorColumn;
    private List<String> status;

    public SelectResult() {
    }

    public SelectResult(SelectResponse response) {
        this.cursorLine = response.getCursorLine();
        this.cursorColumn = response.getCursorColumn();
        this.anchorLine = response.getAnchorLine();
        this.anchorColumn = response.getAnchorColumn();
        this.status = response.getStatus();
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
}
