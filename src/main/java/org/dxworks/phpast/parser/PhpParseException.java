package org.dxworks.phpast.parser;

import java.util.Collections;
import java.util.List;

/**
 * Raised when the PHP source does not parse cleanly and the caller did not ask for the
 * errors to be collected.
 */
public class PhpParseException extends RuntimeException {

    private final List<ParseError> errors;

    public PhpParseException(List<ParseError> errors) {
        super(errors.isEmpty() ? "Syntax error" : errors.get(0).toString());
        this.errors = Collections.unmodifiableList(errors);
    }

    public List<ParseError> getErrors() {
        return errors;
    }
}
