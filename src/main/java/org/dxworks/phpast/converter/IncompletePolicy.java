package org.dxworks.phpast.converter;

/**
 * What to do when a construct is missing a required part, typically because the source
 * did not parse completely.
 */
public enum IncompletePolicy {
    /** Leave the enclosing construct out of the tree. */
    DROP,
    /** Keep the construct and put a sentinel string where the part is missing. */
    PLACEHOLDER;

    public static final String INCOMPLETE_EXPR = "__INCOMPLETE_EXPR__";
    public static final String INCOMPLETE_VARIABLE = "__INCOMPLETE_VARIABLE__";
    public static final String INCOMPLETE_PROPERTY = "__INCOMPLETE_PROPERTY__";
    public static final String INCOMPLETE_CLASS_CONST = "__INCOMPLETE_CLASS_CONST__";
}
