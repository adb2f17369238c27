package io.hyperfoil.tools.select.lsp;

import com.google.gson.annotations.SerializedName;
import io.hyperfoil.tools.select.locate.SelectRequest;

/**
 * Parameters of {@code lisp/select}. Field names on the wire are kebab-case, e.g.
 * {@code cursor-line}. When {@code code} is absent the text of the open document {@code uri}
 * is used.
 */
public class SelectParams {

    private String kind;
    private String code;
    private String uri;
    @SerializedName("cursor-line")
    private Integer cursorLine;
    @SerializedName("cursor-column")
    private Integer cursorColumn;
    @SerializedName("anchor-line")
    private Integer anchorLine;
    @SerializedName("anchor-column")
    private Integer anchorColumn;
    private Integer count;
    private String extent;

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

    public String getUri() {
        return uri;
    }

    public void setUri(String uri) {
        this.uri = uri;
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

    public SelectRequest toRequest() {
        SelectRequest request = new SelectRequest();
        request.setKind(kind);
        request.setCode(code);
        request.setCursorLine(cursorLine);
        request.setCursorColumn(cursorColumn);
        request.setAnchorLine(anchorLine);
        request.setAnchorColumn(anchorColumn);
        request.setCount(count);
        request.setExtent(extent);
        return request;
    }
}
