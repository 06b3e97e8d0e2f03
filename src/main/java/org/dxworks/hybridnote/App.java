package org.dxworks.hybridnote;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.hybridnote.model.DocumentSummary;
import org.dxworks.hybridnote.model.HybridBlock;
import org.dxworks.hybridnote.model.HybridNote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

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
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

public class App {
    private static final Logger logger = LoggerFactory.getLogger(App.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar hybridnote.jar <input-folder> <output-file>");
            System.err.println("  <input-folder>: Path to a notes directory or a single note");
            System.err.println("  <output-file>:  Path to output JSONL file");
            System.err.println("Supported documents: Markdown (.md, .markdown), Org (.org)");
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            System.exit(1);
        }

        Path jsonlOutput = Paths.get(args[1]);
        // Create parent directories if they don't exist
        if (jsonlOutput.getParent() != null) {
            Files.createDirectories(jsonlOutput.getParent());
        }

        System.out.println("Starting block analysis...");
        System.out.println("Input: " + input.toAbsolutePath());

        HybridConfig config = HybridConfig.load();
        List<Path> files = collectDocuments(input, config.getMaxFileLines());
        System.out.println("Found " + files.size() + " documents");

        Instant startTime = Instant.now();
        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger errorCount = new AtomicInteger(0);
        AtomicInteger progressCounter = new AtomicInteger(0);

        try (BufferedWriter writer = Files.newBufferedWriter(jsonlOutput, StandardCharsets.UTF_8)) {
            Map<String, Object> runInfo = new HashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("input_path", input.toString());
            runInfo.put("total_files", files.size());
            writer.write(MAPPER.writeValueAsString(runInfo));
            writer.newLine();

            // Each document gets its own manager, so files can be processed in parallel
            files.parallelStream().forEach(file -> {
                Optional<DocumentType> typeOpt = DocumentTypeDetector.detectType(file);
                if (typeOpt.isEmpty()) {
                    return;
                }

                DocumentType type = typeOpt.get();
                int current = progressCounter.incrementAndGet();

                synchronized (System.out) {
                    System.out.println("[" + current + "/" + files.size() + "] Parsing "
                            + type.getName() + ": " + file.getFileName());
                }

                try {
                    DocumentSummary summary = summarizeFile(file, type, config);

                    synchronized (writer) {
                        writer.write(MAPPER.writeValueAsString(summary));
                        writer.newLine();
                        writer.flush();
                    }

                    successCount.incrementAndGet();
                } catch (Exception e) {
                    Map<String, String> error = new HashMap<>();
                    error.put("kind", "error");
                    error.put("file", file.toString());
                    error.put("type", type.getName());
                    error.put("error", e.getMessage());

                    try {
                        synchronized (writer) {
                            writer.write(MAPPER.writeValueAsString(error));
                            writer.newLine();
                            writer.flush();
                        }
                    } catch (IOException ioException) {
                        logger.error("Failed to write error record for {}", file, ioException);
                    }

                    errorCount.incrementAndGet();
                    synchronized (System.err) {
                        System.err.println("  Error parsing " + file.getFileName() + ": " + e.getMessage());
                    }
                }
            });

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new HashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("files_parsed", successCount.get());
            doneInfo.put("files_with_errors", errorCount.get());
            doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
            writer.write(MAPPER.writeValueAsString(doneInfo));
            writer.newLine();
        }

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Parsing complete!");
        System.out.println("Successfully parsed: " + successCount.get() + " documents");
        if (errorCount.get() > 0) {
            System.out.println("Errors: " + errorCount.get());
        }
        System.out.println("Output written to: " + jsonlOutput.toAbsolutePath());
        System.out.println("=".repeat(60));
    }

    static List<Path> collectDocuments(Path input, int maxFileLines) throws IOException {
        List<Path> files = new ArrayList<>();

        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                      .filter(p -> DocumentTypeDetector.detectType(p).isPresent())
                      .filter(p -> withinMaxLines(p, maxFileLines))
                      .sorted()
                      .forEach(files::add);
            }
        } else if (Files.isRegularFile(input)) {
            if (DocumentTypeDetector.detectType(input).isPresent() && withinMaxLines(input, maxFileLines)) {
                files.add(input);
            }
        }

        return files;
    }

    private static boolean withinMaxLines(Path path, int maxFileLines) {
        try (Stream<String> lines = Files.lines(path, StandardCharsets.UTF_8)) {
            long count = lines.limit((long) maxFileLines + 1L).count();
            if (count > maxFileLines) {
                logger.info("Skipping {}: more than {} lines", path, maxFileLines);
                return false;
            }
            return true;
        } catch (IOException | UncheckedIOException e) {
            // Let the parse step report unreadable files as error records
            logger.warn("Could not count lines of {}: {}", path, e.getMessage());
            return true;
        }
    }

    public static DocumentSummary summarizeFile(Path filePath, DocumentType type) throws IOException {
        return summarizeFile(filePath, type, HybridConfig.defaults());
    }

    public static DocumentSummary summarizeFile(Path filePath, DocumentType type, HybridConfig config) throws IOException {
        String text = Files.readString(filePath, StandardCharsets.UTF_8);

        // Remove BOM if present
        if (text.startsWith("\uFEFF")) {
            text = text.substring(1);
        }

        String fileName = filePath.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String id = dot > 0 ? fileName.substring(0, dot) : fileName;

        HybridNote note = new HybridNote(id, id);
        BlockManager manager = new BlockManager(note, config.withProseSyntax(type.getProseSyntax()),
                ParserRegistry.withDefaults());
        manager.parseDocument(text);
        note.setTitle(titleOf(note, id));

        return manager.summarize(filePath.toString().replace('\\', '/'));
    }

    /**
     * {@code #+TITLE:} keyword or {@code title} front matter key of the first block carrying one.
     */
    private static String titleOf(HybridNote note, String fallback) {
        for (HybridBlock block : note.getBlocks()) {
            String title = block.property("TITLE");
            if (title == null) {
                title = block.property("title");
            }
            if (title != null && !title.isBlank()) {
                return title;
            }
        }
        return fallback;
    }
}
