package com.questrail.tikz.parse.scan;

/**
 * Structural view of one {@code \node[...] (name) ... {label}} statement.
 *
 * <p>All offsets index into the text the statement was scanned from. The
 * statement is only located, not interpreted: style, position and label are
 * kept as raw text.</p>
 *
 * @param start       index of the leading backslash
 * @param end         index just past the statement (past {@code ;} if present)
 * @param styleClause raw text between {@code [} and {@code ]}
 * @param name        node name, trimmed
 * @param nameOpen    index of the {@code (} opening the name
 * @param nameClose   index of the {@code )} closing the name
 * @param leadingClause  raw text between {@code ]} and the name (usually empty)
 * @param trailingClause raw text between the name and the label (or terminator)
 * @param label       raw label text without its outer braces; empty if absent
 * @param hasLabel    whether a brace-delimited label was present
 */
public record NodeStatement(
        int start,
        int end,
        String styleClause,
        String name,
        int nameOpen,
        int nameClose,
        String leadingClause,
        String trailingClause,
        String label,
        boolean hasLabel
) {
    /** Style, leading and trailing clauses joined: all text that may carry a position. */
    public String positionText() {
        return (styleClause + " " + leadingClause + " " + trailingClause).strip();
    }
}
