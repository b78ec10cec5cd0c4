package org.dxworks.phpast.converter;

import org.dxworks.phpast.ast.AstVersion;

/**
 * Settings fixed for the duration of one conversion.
 */
public class ConversionOptions {

    public static final String THROW_INVALID_ENV = "PHPAST_THROW_INVALID";

    private final AstVersion version;
    private final IncompletePolicy incompletePolicy;
    private final boolean strict;

    private ConversionOptions(AstVersion version, IncompletePolicy incompletePolicy, boolean strict) {
        this.version = version;
        this.incompletePolicy = incompletePolicy;
        this.strict = strict;
    }

    /** Drops incomplete constructs; strict only when {@value #THROW_INVALID_ENV} is set. */
    public static ConversionOptions defaults(AstVersion version) {
        return new ConversionOptions(version, IncompletePolicy.DROP, strictFromEnvironment());
    }

    public static ConversionOptions of(AstVersion version, IncompletePolicy incompletePolicy, boolean strict) {
        return new ConversionOptions(version, incompletePolicy, strict);
    }

    public AstVersion getVersion() {
        return version;
    }

    public IncompletePolicy getIncompletePolicy() {
        return incompletePolicy;
    }

    public boolean isStrict() {
        return strict;
    }

    private static boolean strictFromEnvironment() {
        String value = System.getenv(THROW_INVALID_ENV);
        return value != null && !value.isEmpty() && !"0".equals(value);
    }
}
