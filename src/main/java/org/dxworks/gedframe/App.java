package org.dxworks.gedframe;

import org.dxworks.gedframe.exception.GedcomException;
import org.dxworks.gedframe.model.GedcomStats;
import org.dxworks.gedframe.parser.GedcomParser;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

public class App {
    private static final String GEDCOM_EXTENSION = ".ged";

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar gedframe.jar <input> <output> [json|gedcom]");
            System.err.println("  <input>:  GEDCOM file, or folder scanned for *.ged files");
            System.err.println("  <output>: output file, or output folder when <input> is a folder");
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            System.exit(1);
        }

        GedframeConfig config = GedframeConfig.load();
        ExportFormat format;
        try {
            format = args.length > 2 ? ExportFormat.fromName(args[2]) : config.getDefaultFormat();
        } catch (GedcomException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(2);
            return;
        }

        Path output = Paths.get(args[1]);
        boolean folderMode = Files.isDirectory(input);
        Path outputFolder = folderMode ? output : output.getParent();
        if (outputFolder != null) {
            Files.createDirectories(outputFolder);
        }

        System.out.println("Starting GEDCOM conversion...");
        System.out.println("Input: " + input.toAbsolutePath());

        List<Path> files = collectGedcomFiles(input, config.getMaxFileLines());
        System.out.println("Found " + files.size() + " GEDCOM files");

        Instant startTime = Instant.now();
        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger errorCount = new AtomicInteger(0);
        AtomicInteger progressCounter = new AtomicInteger(0);

        // one parser per file, so files can be converted in parallel
        files.parallelStream().forEach(file -> {
            int current = progressCounter.incrementAndGet();
            synchronized (System.out) {
                System.out.println("[" + current + "/" + files.size() + "] Converting " + file.getFileName());
            }

            Path target = folderMode ? output.resolve(outputName(file, format)) : output;
            try {
                GedcomStats stats = convertFile(file, target, format, config);
                successCount.incrementAndGet();
                synchronized (System.out) {
                    System.out.println("  " + stats);
                }
            } catch (GedcomException | IOException | UncheckedIOException e) {
                errorCount.incrementAndGet();
                synchronized (System.err) {
                    System.err.println("  Error converting " + file.getFileName() + ": " + e.getMessage());
                }
            }
        });

        Instant endTime = Instant.now();
        System.out.println("\n" + "=".repeat(60));
        System.out.println("Conversion complete!");
        System.out.println("Successfully converted: " + successCount.get() + " files");
        if (errorCount.get() > 0) {
            System.out.println("Errors: " + errorCount.get());
        }
        System.out.println("Duration: " + Duration.between(startTime, endTime).getSeconds() + "s");
        System.out.println("Output written to: " + output.toAbsolutePath());
        System.out.println("=".repeat(60));
    }

    /**
     * Verifies, parses and exports a single file.
     *
     * @throws org.dxworks.gedframe.exception.StructuralNestingException if the level check fails
     */
    public static GedcomStats convertFile(Path input, Path output, ExportFormat format, GedframeConfig config) throws IOException {
        GedcomParser parser = GedcomParser.ofFile(input, config);
        parser.verify().throwIfInvalid();
        parser.parse();
        String content = parser.export(format, config.isExportEmptyFields());
        Files.writeString(output, content, StandardCharsets.UTF_8);
        return parser.getStats();
    }

    static List<Path> collectGedcomFiles(Path input, int maxFileLines) throws IOException {
        List<Path> files = new ArrayList<>();

        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                      .filter(App::isGedcomFile)
                      .filter(p -> withinMaxLines(p, maxFileLines))
                      .sorted()
                      .forEach(files::add);
            }
        } else if (Files.isRegularFile(input) && withinMaxLines(input, maxFileLines)) {
            files.add(input);
        }

        return files;
    }

    private static boolean isGedcomFile(Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(GEDCOM_EXTENSION);
    }

    private static boolean withinMaxLines(Path path, int maxFileLines) {
        try (Stream<String> lines = Files.lines(path, StandardCharsets.UTF_8)) {
            long count = lines.limit((long) maxFileLines + 1L).count();
            if (count > maxFileLines) {
                System.err.println("Skipping " + path + ": more than " + maxFileLines + " lines");
                return false;
            }
            return true;
        } catch (IOException | UncheckedIOException e) {
            // convertFile reports the read failure
            return true;
        }
    }

    private static String outputName(Path file, ExportFormat format) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return base + "." + format.getExtension();
    }
}
