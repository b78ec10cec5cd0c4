package org.dxworks.phpast;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.phpast.ast.AstVersion;
import org.dxworks.phpast.converter.ConversionOptions;
import org.dxworks.phpast.converter.IncompletePolicy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class PhpAstConfig {

    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final int DEFAULT_AST_VERSION = 50;
    private static final boolean DEFAULT_ADD_PLACEHOLDERS = false;
    private static final boolean DEFAULT_STRICT = false;
    private static final boolean DEFAULT_COLLECT_ERRORS = true;
    static final String CONFIG_FILE_NAME = "phpast-config.yml";

    private final int maxFileLines;
    private final int astVersion;
    private final boolean addPlaceholders;
    private final boolean strict;
    private final boolean collectErrors;

    private PhpAstConfig(int maxFileLines, int astVersion, boolean addPlaceholders, boolean strict, boolean collectErrors) {
        this.maxFileLines = maxFileLines;
        this.astVersion = astVersion;
        this.addPlaceholders = addPlaceholders;
        this.strict = strict;
        this.collectErrors = collectErrors;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    public int getAstVersion() {
        return astVersion;
    }

    public boolean isAddPlaceholders() {
        return addPlaceholders;
    }

    public boolean isStrict() {
        return strict;
    }

    public boolean isCollectErrors() {
        return collectErrors;
    }

    /**
     * @throws org.dxworks.phpast.ast.UnsupportedAstVersionException if the configured version is not 40 or 50
     */
    public ConversionOptions toConversionOptions() {
        return ConversionOptions.of(AstVersion.of(astVersion),
                addPlaceholders ? IncompletePolicy.PLACEHOLDER : IncompletePolicy.DROP, strict);
    }

    public static PhpAstConfig defaults() {
        return new PhpAstConfig(DEFAULT_MAX_FILE_LINES, DEFAULT_AST_VERSION, DEFAULT_ADD_PLACEHOLDERS,
                DEFAULT_STRICT, DEFAULT_COLLECT_ERRORS);
    }

    public static PhpAstConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static PhpAstConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                int effectiveMaxFileLines = (yamlConfig.maxFileLines != null && yamlConfig.maxFileLines > 0)
                        ? yamlConfig.maxFileLines
                        : DEFAULT_MAX_FILE_LINES;
                int effectiveAstVersion = yamlConfig.astVersion != null ? yamlConfig.astVersion : DEFAULT_AST_VERSION;
                boolean effectiveAddPlaceholders = yamlConfig.addPlaceholders != null
                        ? yamlConfig.addPlaceholders
                        : DEFAULT_ADD_PLACEHOLDERS;
                boolean effectiveStrict = yamlConfig.strict != null ? yamlConfig.strict : DEFAULT_STRICT;
                boolean effectiveCollectErrors = yamlConfig.collectErrors != null
                        ? yamlConfig.collectErrors
                        : DEFAULT_COLLECT_ERRORS;

                return new PhpAstConfig(effectiveMaxFileLines, effectiveAstVersion, effectiveAddPlaceholders,
                        effectiveStrict, effectiveCollectErrors);
            }
        } catch (IOException e) {
            System.err.println("Ignoring unreadable " + configPath + ": " + e.getMessage());
        }

        return defaults();
    }

    public static PhpAstConfig with(int maxFileLines, int astVersion, boolean addPlaceholders, boolean strict,
                                    boolean collectErrors) {
        int effectiveMaxFileLines = maxFileLines > 0 ? maxFileLines : DEFAULT_MAX_FILE_LINES;
        return new PhpAstConfig(effectiveMaxFileLines, astVersion, addPlaceholders, strict, collectErrors);
    }

    private static class YamlConfig {
        public Integer maxFileLines;
        public Integer astVersion;
        public Boolean addPlaceholders;
        public Boolean strict;
        public Boolean collectErrors;
    }
}
