package org.dxworks.phpast;

import com.fasterxml.jackson.databind.JsonNode;
import org.dxworks.phpast.ast.AstVersion;
import org.dxworks.phpast.converter.ConversionOptions;
import org.dxworks.phpast.converter.IncompletePolicy;
import org.dxworks.phpast.parser.PhpParseException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class AppTest {

    private static final Path SAMPLES = Paths.get("src/test/resources/samples/php");
    private static final ConversionOptions OPTIONS =
            ConversionOptions.of(AstVersion.V50, IncompletePolicy.DROP, false);

    @Test
    void convertFileProducesARecord() throws IOException {
        Map<String, Object> record = App.convertFile(SAMPLES.resolve("Greeter.php"), OPTIONS, true);

        assertEquals("file", record.get("kind"));
        assertEquals(50, record.get("astVersion"));
        assertEquals(List.of(), record.get("errors"));

        JsonNode ast = (JsonNode) record.get("ast");
        assertEquals("AST_STMT_LIST", ast.get("kind").asText());
        JsonNode namespace = ast.get("children").get("0");
        assertEquals("AST_NAMESPACE", namespace.get("kind").asText());
        assertEquals("App", namespace.get("children").get("name").asText());
        JsonNode greeter = ast.get("children").get("1");
        assertEquals("AST_CLASS", greeter.get("kind").asText());
        assertEquals("Greeter", greeter.get("children").get("name").asText());
        assertTrue(greeter.get("children").get("docComment").asText().contains("Says hello."));
    }

    @Test
    void syntaxErrorsAreListedWhenCollected() throws IOException {
        Map<String, Object> record = App.convertFile(SAMPLES.resolve("broken.php"), OPTIONS, true);

        List<?> errors = (List<?>) record.get("errors");
        assertFalse(errors.isEmpty());
        assertNotNull(record.get("ast"));
    }

    @Test
    void syntaxErrorsFailTheFileOtherwise() {
        assertThrows(PhpParseException.class, () -> App.convertFile(SAMPLES.resolve("broken.php"), OPTIONS, false));
    }

    @Test
    void collectsOnlyPhpSourcesInPathOrder() throws IOException {
        List<Path> files = App.collectSourceFiles(SAMPLES, 20000);

        assertEquals(List.of(SAMPLES.resolve("Greeter.php"), SAMPLES.resolve("broken.php"),
                SAMPLES.resolve("template.phtml")), files);
    }

    @Test
    void filesOverTheLineLimitAreSkipped() throws IOException {
        List<Path> files = App.collectSourceFiles(SAMPLES, 3);

        assertEquals(List.of(SAMPLES.resolve("broken.php"), SAMPLES.resolve("template.phtml")), files);
    }

    @Test
    void filesThatAreNotUtf8AreKeptForConversion(@TempDir Path dir) throws IOException {
        Path latin1 = dir.resolve("legacy.php");
        Files.write(latin1, new byte[]{'<', '?', 'p', 'h', 'p', ' ', '"', (byte) 0xE9, '"', ';', '\n'});

        assertEquals(List.of(latin1), App.collectSourceFiles(dir, 10));
    }

    @Test
    void detectsPhpExtensions() {
        assertTrue(SourceFileDetector.isPhpSource(Paths.get("a/Index.PHP")));
        assertTrue(SourceFileDetector.isPhpSource(Paths.get("view.phtml")));
        assertTrue(SourceFileDetector.isPhpSource(Paths.get("config.inc")));
        assertFalse(SourceFileDetector.isPhpSource(Paths.get("README.txt")));
    }
}
