package org.dxworks.hybridnote;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class HybridConfig {

    private static final Logger logger = LoggerFactory.getLogger(HybridConfig.class);

    static final String CONFIG_FILE_NAME = "hybridnote-config.yml";

    private static final int DEFAULT_MAX_FILE_LINES = 20000;
    private static final boolean DEFAULT_STRICT_DETECTION = false;
    private static final boolean DEFAULT_SPLIT_MARKDOWN_ON_BLANK_LINES = true;
    private static final SyntaxKind DEFAULT_PROSE_SYNTAX = SyntaxKind.MARKDOWN;
    private static final boolean DEFAULT_PARALLEL_PARSING = false;

    private static final HybridConfig DEFAULTS = new HybridConfig(
            DEFAULT_MAX_FILE_LINES,
            DEFAULT_STRICT_DETECTION,
            DEFAULT_SPLIT_MARKDOWN_ON_BLANK_LINES,
            DEFAULT_PROSE_SYNTAX,
            DEFAULT_PARALLEL_PARSING);

    private final int maxFileLines;
    private final boolean strictDetection;
    private final boolean splitMarkdownOnBlankLines;
    private final SyntaxKind proseSyntax;
    private final boolean parallelParsing;

    private HybridConfig(int maxFileLines, boolean strictDetection, boolean splitMarkdownOnBlankLines,
                         SyntaxKind proseSyntax, boolean parallelParsing) {
        this.maxFileLines = maxFileLines;
        this.strictDetection = strictDetection;
        this.splitMarkdownOnBlankLines = splitMarkdownOnBlankLines;
        this.proseSyntax = proseSyntax;
        this.parallelParsing = parallelParsing;
    }

    public int getMaxFileLines() {
        return maxFileLines;
    }

    /**
     * When set, an unterminated special block fails detection instead of being closed at end of document.
     */
    public boolean isStrictDetection() {
        return strictDetection;
    }

    public boolean isSplitMarkdownOnBlankLines() {
        return splitMarkdownOnBlankLines;
    }

    /**
     * Syntax given to runs of text outside special blocks.
     */
    public SyntaxKind getProseSyntax() {
        return proseSyntax;
    }

    public boolean isParallelParsing() {
        return parallelParsing;
    }

    public static HybridConfig defaults() {
        return DEFAULTS;
    }

    public static HybridConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static HybridConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return DEFAULTS;
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                int effectiveMaxFileLines = (yamlConfig.maxFileLines != null && yamlConfig.maxFileLines > 0)
                        ? yamlConfig.maxFileLines
                        : DEFAULT_MAX_FILE_LINES;
                boolean effectiveStrict = yamlConfig.strictDetection != null
                        ? yamlConfig.strictDetection
                        : DEFAULT_STRICT_DETECTION;
                boolean effectiveSplit = yamlConfig.splitMarkdownOnBlankLines != null
                        ? yamlConfig.splitMarkdownOnBlankLines
                        : DEFAULT_SPLIT_MARKDOWN_ON_BLANK_LINES;
                boolean effectiveParallel = yamlConfig.parallelParsing != null
                        ? yamlConfig.parallelParsing
                        : DEFAULT_PARALLEL_PARSING;

                return new HybridConfig(effectiveMaxFileLines, effectiveStrict, effectiveSplit,
                        proseSyntaxOrDefault(yamlConfig.proseSyntax), effectiveParallel);
            }
        } catch (IOException e) {
            logger.warn("Could not read {}, using defaults: {}", configPath, e.getMessage());
        }

        return DEFAULTS;
    }

    private static SyntaxKind proseSyntaxOrDefault(String name) {
        if (name == null || name.isBlank()) {
            return DEFAULT_PROSE_SYNTAX;
        }
        try {
            return requireProseSyntax(SyntaxKind.parse(name));
        } catch (IllegalArgumentException e) {
            logger.warn("Unsupported proseSyntax '{}', using {}", name, DEFAULT_PROSE_SYNTAX);
            return DEFAULT_PROSE_SYNTAX;
        }
    }

    private static SyntaxKind requireProseSyntax(SyntaxKind kind) {
        if (!kind.equals(SyntaxKind.MARKDOWN) && !kind.equals(SyntaxKind.ORG)) {
            throw new IllegalArgumentException("Prose syntax must be markdown or org, was " + kind);
        }
        return kind;
    }

    public static HybridConfig with(int maxFileLines, boolean strictDetection) {
        int effectiveMaxFileLines = maxFileLines > 0 ? maxFileLines : DEFAULT_MAX_FILE_LINES;
        return new HybridConfig(effectiveMaxFileLines, strictDetection, DEFAULT_SPLIT_MARKDOWN_ON_BLANK_LINES,
                DEFAULT_PROSE_SYNTAX, DEFAULT_PARALLEL_PARSING);
    }

    public HybridConfig withStrictDetection(boolean strict) {
        return new HybridConfig(maxFileLines, strict, splitMarkdownOnBlankLines, proseSyntax, parallelParsing);
    }

    public HybridConfig withSplitMarkdownOnBlankLines(boolean split) {
        return new HybridConfig(maxFileLines, strictDetection, split, proseSyntax, parallelParsing);
    }

    public HybridConfig withProseSyntax(SyntaxKind kind) {
        return new HybridConfig(maxFileLines, strictDetection, splitMarkdownOnBlankLines,
                requireProseSyntax(kind), parallelParsing);
    }

    public HybridConfig withParallelParsing(boolean parallel) {
        return new HybridConfig(maxFileLines, strictDetection, splitMarkdownOnBlankLines, proseSyntax, parallel);
    }

    private static class YamlConfig {
        public Integer maxFileLines;
        public Boolean strictDetection;
        public Boolean splitMarkdownOnBlankLines;
        public String proseSyntax;
        public Boolean parallelParsing;
    }
}
