package org.dxworks.phpast;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.phpast.ast.AstJson;
import org.dxworks.phpast.ast.AstNode;
import org.dxworks.phpast.converter.AstConverter;
import org.dxworks.phpast.converter.ConversionOptions;
import org.dxworks.phpast.parser.ParseError;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final AstConverter CONVERTER = new AstConverter();

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar phpast.jar <input-folder> <output-file>");
            System.err.println("  <input-folder>: Path to a PHP source directory or file");
            System.err.println("  <output-file>:  Path to output JSONL file");
            System.err.println("Converted files: .php, .phtml, .inc");
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            System.exit(1);
        }

        Path jsonlOutput = Paths.get(args[1]);
        if (jsonlOutput.getParent() != null) {
            Files.createDirectories(jsonlOutput.getParent());
        }

        PhpAstConfig config = PhpAstConfig.load();
        ConversionOptions options = config.toConversionOptions();

        System.out.println("Starting php-ast conversion...");
        System.out.println("Input: " + input.toAbsolutePath());
        System.out.println("AST version: " + options.getVersion().getNumber());

        List<Path> files = collectSourceFiles(input, config.getMaxFileLines());
        System.out.println("Found " + files.size() + " PHP files");

        Instant startTime = Instant.now();
        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger errorCount = new AtomicInteger(0);
        AtomicInteger progressCounter = new AtomicInteger(0);

        try (BufferedWriter writer = Files.newBufferedWriter(jsonlOutput, StandardCharsets.UTF_8)) {
            Map<String, Object> runInfo = new HashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("input_path", input.toString());
            runInfo.put("ast_version", options.getVersion().getNumber());
            runInfo.put("total_files", files.size());
            writer.write(MAPPER.writeValueAsString(runInfo));
            writer.newLine();

            // Each file gets its own conversion session, so files convert in parallel
            files.parallelStream().forEach(file -> {
                int current = progressCounter.incrementAndGet();

                synchronized (System.out) {
                    System.out.println("[" + current + "/" + files.size() + "] Converting " + file.getFileName());
                }

                try {
                    Map<String, Object> record = convertFile(file, options, config.isCollectErrors());

                    synchronized (writer) {
                        writer.write(MAPPER.writeValueAsString(record));
                        writer.newLine();
                        writer.flush();
                    }

                    successCount.incrementAndGet();
                } catch (Exception e) {
                    Map<String, String> error = new HashMap<>();
                    error.put("kind", "error");
                    error.put("file", file.toString());
                    error.put("error", e.getMessage());

                    try {
                        synchronized (writer) {
                            writer.write(MAPPER.writeValueAsString(error));
                            writer.newLine();
                            writer.flush();
                        }
                    } catch (IOException ioException) {
                        System.err.println("Failed to write error for " + file + ": " + ioException.getMessage());
                    }

                    errorCount.incrementAndGet();
                    synchronized (System.err) {
                        System.err.println("  Error converting " + file.getFileName() + ": " + e.getMessage());
                    }
                }
            });

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new HashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("files_converted", successCount.get());
            doneInfo.put("files_with_errors", errorCount.get());
            doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
            writer.write(MAPPER.writeValueAsString(doneInfo));
            writer.newLine();
        }

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Conversion complete!");
        System.out.println("Successfully converted: " + successCount.get() + " files");
        if (errorCount.get() > 0) {
            System.out.println("Errors: " + errorCount.get());
        }
        System.out.println("Output written to: " + jsonlOutput.toAbsolutePath());
        System.out.println("=".repeat(60));
    }

    static List<Path> collectSourceFiles(Path input, int maxFileLines) throws IOException {
        List<Path> files = new ArrayList<>();

        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                      .filter(SourceFileDetector::isPhpSource)
                      .filter(p -> withinMaxLines(p, maxFileLines))
                      .sorted()
                      .forEach(files::add);
            }
        } else if (Files.isRegularFile(input)) {
            if (SourceFileDetector.isPhpSource(input) && withinMaxLines(input, maxFileLines)) {
                files.add(input);
            }
        }

        return files;
    }

    private static boolean withinMaxLines(Path path, int maxFileLines) {
        try (Stream<String> lines = Files.lines(path, StandardCharsets.UTF_8)) {
            long count = lines.limit((long) maxFileLines + 1L).count();
            return count <= maxFileLines;
        } catch (IOException | UncheckedIOException e) {
            // unreadable as UTF-8 lines; let the conversion report it
            return true;
        }
    }

    /**
     * Converts one file into its output record. With {@code collectErrors} syntax errors
     * are listed in the record; otherwise they fail the file.
     */
    public static Map<String, Object> convertFile(Path filePath, ConversionOptions options, boolean collectErrors)
            throws IOException {
        String sourceCode = Files.readString(filePath, StandardCharsets.UTF_8);

        List<ParseError> errors = collectErrors ? new ArrayList<>() : null;
        AstNode ast = CONVERTER.parseCode(sourceCode, options, errors);

        Map<String, Object> record = new LinkedHashMap<>();
        record.put("kind", "file");
        record.put("file", filePath.toString());
        record.put("astVersion", options.getVersion().getNumber());
        record.put("ast", AstJson.toJson(ast));
        List<Map<String, Object>> errorRecords = new ArrayList<>();
        if (errors != null) {
            for (ParseError error : errors) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("message", error.message);
                entry.put("line", error.line);
                entry.put("column", error.column);
                errorRecords.add(entry);
            }
        }
        record.put("errors", errorRecords);
        return record;
    }
}
