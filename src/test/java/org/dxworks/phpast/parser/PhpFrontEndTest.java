package org.dxworks.phpast.parser;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PhpFrontEndTest {

    private final PhpFrontEnd frontEnd = new PhpFrontEnd();

    @Test
    void cleanSourceHasNoErrors() {
        ParsedSource parsed = frontEnd.parse("<?php\necho 'hi';\n");

        assertFalse(parsed.hasErrors());
        assertEquals("program", parsed.getRootNode().getType());
        assertTrue(PhpFrontEnd.collectErrors(parsed).isEmpty());
    }

    @Test
    void byteOrderMarkIsDropped() {
        ParsedSource parsed = frontEnd.parse("\uFEFF<?php echo 1;");

        assertTrue(parsed.getText().getSource().startsWith("<?php"));
        assertFalse(parsed.hasErrors());
    }

    @Test
    void errorsCarryTheirPosition() {
        ParsedSource parsed = frontEnd.parse("<?php\n$x = 1;\n$y = ;\n");

        List<ParseError> errors = PhpFrontEnd.collectErrors(parsed);

        assertTrue(parsed.hasErrors());
        assertFalse(errors.isEmpty());
        assertEquals(3, errors.get(0).line);
        assertTrue(errors.get(0).message.startsWith("Syntax error"));
    }

    @Test
    void parseExceptionReportsTheFirstError() {
        ParseError first = new ParseError("Syntax error, unexpected ';'", 3, 6);
        PhpParseException e = new PhpParseException(List.of(first, new ParseError("Syntax error, missing ')'", 4, 1)));

        assertEquals("Syntax error, unexpected ';' on line 3", e.getMessage());
        assertEquals(2, e.getErrors().size());
    }

    @Test
    void sourceSlicesUseByteOffsets() {
        SourceText text = new SourceText("<?php echo \"é\";");

        assertEquals("<?php", text.slice(0, 5));
        assertEquals("é", text.slice(12, 14));
        assertEquals('<', text.byteAt(0));
        assertEquals(-1, text.byteAt(1000));
    }
}
