package org.dxworks.phpast.ast;

/**
 * The php-ast versions the converter can produce.
 */
public enum AstVersion {
    V40(40),
    V50(50);

    private final int number;

    AstVersion(int number) {
        this.number = number;
    }

    public int getNumber() {
        return number;
    }

    /** Version 45 moved declaration names and doc comments into the children mapping. */
    public boolean hasDeclHeaderChildren() {
        return number >= 45;
    }

    /** Version 45 made {@code object} a type rather than a class name. */
    public boolean hasObjectType() {
        return number >= 45;
    }

    public boolean hasDeclIds() {
        return number >= 50;
    }

    public static AstVersion of(int number) {
        for (AstVersion version : values()) {
            if (version.number == number) return version;
        }
        throw new UnsupportedAstVersionException(number);
    }
}
