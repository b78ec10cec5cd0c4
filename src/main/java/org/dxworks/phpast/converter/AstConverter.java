package org.dxworks.phpast.converter;

import org.dxworks.phpast.ast.AstNode;
import org.dxworks.phpast.ast.AstVersion;
import org.dxworks.phpast.parser.ParseError;
import org.dxworks.phpast.parser.ParsedSource;
import org.dxworks.phpast.parser.PhpFrontEnd;
import org.dxworks.phpast.parser.PhpParseException;

import java.util.List;

/**
 * Converts PHP source code into a php-ast tree of the requested version.
 *
 * <p>Every call uses its own {@link ConversionSession}, so declaration ids restart at 0
 * and concurrent calls do not interfere.
 */
public class AstConverter {

    private final PhpFrontEnd frontEnd = new PhpFrontEnd();

    /**
     * @throws org.dxworks.phpast.ast.UnsupportedAstVersionException if the version is not 40 or 50
     * @throws PhpParseException if the source has syntax errors
     */
    public AstNode parseCode(String source, int version) {
        return parseCode(source, ConversionOptions.defaults(AstVersion.of(version)), null);
    }

    /**
     * Error-collection mode: syntax errors are appended to {@code errors} and the tree
     * holds whatever could be converted.
     */
    public AstNode parseCode(String source, int version, List<ParseError> errors) {
        return parseCode(source, ConversionOptions.defaults(AstVersion.of(version)), errors);
    }

    /**
     * @param errors receives syntax errors; when {@code null}, syntax errors raise a
     *               {@link PhpParseException} instead
     */
    public AstNode parseCode(String source, ConversionOptions options, List<ParseError> errors) {
        ParsedSource parsed = frontEnd.parse(source);
        if (parsed.hasErrors()) {
            List<ParseError> found = PhpFrontEnd.collectErrors(parsed);
            if (errors == null) {
                throw new PhpParseException(found);
            }
            errors.addAll(found);
        }
        return convert(parsed, options);
    }

    /** Converts an already parsed tree. */
    public AstNode convert(ParsedSource parsed, ConversionOptions options) {
        ConversionSession session = new ConversionSession(parsed.getText(), options);
        return (AstNode) session.convert(parsed.getRootNode());
    }
}
