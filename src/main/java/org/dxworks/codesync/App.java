package org.dxworks.codesync;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.dxworks.codesync.analyzer.java.JavaStructureParser;
import org.dxworks.codesync.analyzer.markdown.MarkdownStructureParser;
import org.dxworks.codesync.change.ChangeOutcome;
import org.dxworks.codesync.change.ChangeReportGenerator;
import org.dxworks.codesync.change.ChangeRequest;
import org.dxworks.codesync.change.ChangeRequestApplier;
import org.dxworks.codesync.change.ChangeRequestReader;
import org.dxworks.codesync.change.EditInstruction;
import org.dxworks.codesync.error.StructureException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    public static void main(String[] args) throws Exception {
        if (args.length < 1) {
            printUsage();
            System.exit(2);
        }

        switch (args[0]) {
            case "structure":
                if (args.length < 2) {
                    printUsage();
                    System.exit(2);
                }
                System.exit(printStructure(Paths.get(args[1])));
                break;
            case "apply":
                if (args.length < 4) {
                    printUsage();
                    System.exit(2);
                }
                System.exit(applyChangeRequest(Paths.get(args[1]), Paths.get(args[2]), Paths.get(args[3])));
                break;
            default:
                System.err.println("Unknown command: " + args[0]);
                printUsage();
                System.exit(2);
        }
    }

    private static void printUsage() {
        System.err.println("Usage: java -jar codesync.jar <command> <args>");
        System.err.println("  structure <file>                                   Print the structure of a .java or .md file as JSON");
        System.err.println("  apply <change-request> <source-root> <output-dir>  Apply a change request, write test spec and deployment guide");
        System.err.println("Supported files: Java (.java), Markdown (.md, .markdown)");
    }

    static int printStructure(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            System.err.println("Error: File does not exist: " + file);
            return 1;
        }
        Optional<Language> language = LanguageDetector.detectLanguage(file);
        if (language.isEmpty()) {
            System.err.println("Error: Unsupported file type: " + file.getFileName());
            return 1;
        }

        String text = Files.readString(file, StandardCharsets.UTF_8);
        try {
            Object root = language.get() == Language.JAVA
                    ? new JavaStructureParser().parse(text).root()
                    : new MarkdownStructureParser().parse(text).root();
            System.out.println(MAPPER.writeValueAsString(root));
            return 0;
        } catch (StructureException e) {
            System.err.println("Error analyzing " + file.getFileName() + ": " + e.getMessage());
            return 1;
        }
    }

    static int applyChangeRequest(Path requestFile, Path sourceRoot, Path outputDir) throws IOException {
        if (!Files.isRegularFile(requestFile)) {
            System.err.println("Error: Change request does not exist: " + requestFile);
            return 1;
        }
        if (!Files.isDirectory(sourceRoot)) {
            System.err.println("Error: Source root is not a directory: " + sourceRoot);
            return 1;
        }

        CodesyncConfig config = CodesyncConfig.load();
        ChangeRequest request = new ChangeRequestReader().read(requestFile);
        System.out.println("Applying change request: " + request.featureName
                + " (" + request.changeType.getValue() + ")");
        System.out.println("Source root: " + sourceRoot.toAbsolutePath());

        Map<String, String> files = loadReferencedFiles(request, sourceRoot, config.getMaxFileLines());
        ChangeRequestApplier applier = new ChangeRequestApplier(config, DiagnosticSink.to(System.out));
        ChangeOutcome outcome = applier.apply(request, files);

        writeFiles(outcome.getChangedTexts(), outputDir);
        Map<String, String> reports = new ChangeReportGenerator(config, DiagnosticSink.to(System.out))
                .generate(request, sourceRoot, outcome.getChangedTexts(), LocalDate.now());
        writeFiles(reports, outputDir);

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Change request applied");
        System.out.println("Edits applied: " + (outcome.getEdits().size() - outcome.failureCount()));
        if (outcome.failureCount() > 0) {
            System.out.println("Edits failed: " + outcome.failureCount());
        }
        if (outcome.isStopped()) {
            System.out.println("Stopped at the first failure (failFast)");
        }
        System.out.println("Files written: " + outcome.getChangedTexts().size());
        System.out.println("Reports written: " + String.join(", ", reports.keySet()));
        System.out.println("Output written to: " + outputDir.toAbsolutePath());
        System.out.println("=".repeat(60));
        return outcome.isSuccessful() ? 0 : 1;
    }

    private static void writeFiles(Map<String, String> texts, Path outputDir) throws IOException {
        for (Map.Entry<String, String> entry : texts.entrySet()) {
            Path target = outputDir.resolve(entry.getKey()).normalize();
            if (!target.startsWith(outputDir.normalize())) {
                System.err.println("  Skipping file outside the output directory: " + entry.getKey());
                continue;
            }
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            Files.writeString(target, entry.getValue(), StandardCharsets.UTF_8);
        }
    }

    private static Map<String, String> loadReferencedFiles(ChangeRequest request, Path sourceRoot, int maxFileLines)
            throws IOException {
        Map<String, String> files = new LinkedHashMap<>();
        for (EditInstruction edit : request.edits) {
            if (edit == null || edit.file == null || files.containsKey(edit.file)) {
                continue;
            }
            Path path = sourceRoot.resolve(edit.file);
            if (!Files.isRegularFile(path)) {
                System.err.println("  Missing file: " + edit.file);
                continue;
            }
            if (!withinMaxLines(path, maxFileLines)) {
                System.err.println("  Skipping " + edit.file + ": longer than " + maxFileLines + " lines");
                continue;
            }
            files.put(edit.file, Files.readString(path, StandardCharsets.UTF_8));
        }
        return files;
    }

    private static boolean withinMaxLines(Path path, int maxFileLines) throws IOException {
        try (Stream<String> lines = Files.lines(path, StandardCharsets.UTF_8)) {
            long count = lines.limit((long) maxFileLines + 1L).count();
            return count <= maxFileLines;
        }
    }
}
