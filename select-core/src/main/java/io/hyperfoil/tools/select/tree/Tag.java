package io.hyperfoil.tools.select.tree;

/**
 * The closed set of node categories produced by the reader.
 * Every tag knows the fixed text that opens and closes it, so a node's source is its
 * opening text, its children's source in order, then its closing text.
 */
public enum Tag {
    /** The document root */
    FORMS("forms", "", ""),

    TOKEN("token", "", ""),
    REGEX("regex", "", ""),
    MULTI_LINE("multi-line", "", ""),

    LIST("list", "(", ")"),
    MAP("map", "{", "}"),
    SET("set", "#{", "}"),
    VECTOR("vector", "[", "]"),
    FN("fn", "#(", ")"),

    META("meta", "^", ""),
    META_STAR("meta*", "#^", ""),
    READER_MACRO("reader-macro", "#", ""),
    NAMESPACED_MAP("namespaced-map", "#", ""),

    QUOTE("quote", "'", ""),
    SYNTAX_QUOTE("syntax-quote", "`", ""),
    UNQUOTE("unquote", "~", ""),
    UNQUOTE_SPLICING("unquote-splicing", "~@", ""),

    DEREF("deref", "@", ""),
    VAR("var", "#'", ""),
    UNEVAL("uneval", "#_", ""),
    EVAL("eval", "#=", ""),

    WHITESPACE("whitespace", "", ""),
    NEWLINE("newline", "", ""),
    COMMA("comma", "", ""),
    COMMENT("comment", "", "");

    private final String name;
    private final String open;
    private final String close;

    Tag(String name, String open, String close) {
        this.name = name;
        this.open = open;
        this.close = close;
    }

    /** The name editors and logs know the tag by, e.g. {@code meta*} */
    public String getName() {
        return name;
    }

    public String getOpen() {
        return open;
    }

    public String getClose() {
        return close;
    }

    /** Leaves that stand for a value: tokens, regexes and multi-line strings */
    public boolean isObjectLeaf() {
        return this == TOKEN || this == REGEX || this == MULTI_LINE;
    }

    public boolean isContainer() {
        return this == LIST || this == MAP || this == SET || this == VECTOR;
    }

    /** Two-child nodes: a marker or dispatch child followed by the payload child */
    public boolean isDecorator() {
        return this == META || this == META_STAR || this == READER_MACRO || this == NAMESPACED_MAP;
    }

    public boolean isQuoting() {
        return this == QUOTE || this == SYNTAX_QUOTE || this == UNQUOTE || this == UNQUOTE_SPLICING;
    }

    /** Nodes that cursor navigation steps over */
    public boolean isTrivia() {
        return this == WHITESPACE || this == NEWLINE || this == COMMA || this == COMMENT;
    }

    @Override
    public String toString() {
        return name;
    }
}
