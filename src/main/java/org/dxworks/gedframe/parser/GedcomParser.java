package org.dxworks.gedframe.parser;

import org.dxworks.gedframe.ExportFormat;
import org.dxworks.gedframe.GedframeConfig;
import org.dxworks.gedframe.element.GedcomElement;
import org.dxworks.gedframe.element.GedcomTag;
import org.dxworks.gedframe.element.root.GedcomFamily;
import org.dxworks.gedframe.element.root.GedcomHead;
import org.dxworks.gedframe.element.root.GedcomIndividual;
import org.dxworks.gedframe.element.root.GedcomObject;
import org.dxworks.gedframe.element.root.GedcomRecord;
import org.dxworks.gedframe.element.root.GedcomRepository;
import org.dxworks.gedframe.element.root.GedcomSource;
import org.dxworks.gedframe.element.root.RecordType;
import org.dxworks.gedframe.export.GedcomExporter;
import org.dxworks.gedframe.export.GedcomTextExporter;
import org.dxworks.gedframe.export.JsonExporter;
import org.dxworks.gedframe.model.GedcomStats;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Entry point for reading a GEDCOM source: verify it, parse it into top-level
 * collections, look records up, resolve family relations and export.
 * <p>
 * An instance owns its collections and is not safe for concurrent use.
 * Every {@link #parse()} starts from empty collections.
 */
public class GedcomParser {
    private final Path path;
    private final String text;
    private final GedframeConfig config;

    private GedcomHead head;
    private final List<GedcomIndividual> individuals = new ArrayList<>();
    private final List<GedcomFamily> families = new ArrayList<>();
    private final List<GedcomSource> sources = new ArrayList<>();
    private final List<GedcomObject> objects = new ArrayList<>();
    private final List<GedcomRepository> repositories = new ArrayList<>();

    private GedcomParser(Path path, String text, GedframeConfig config) {
        this.path = path;
        this.text = text;
        this.config = config;
    }

    public static GedcomParser ofFile(Path path) {
        return ofFile(path, GedframeConfig.defaults());
    }

    public static GedcomParser ofFile(Path path, GedframeConfig config) {
        return new GedcomParser(path, null, config);
    }

    public static GedcomParser ofText(String text) {
        return ofText(text, GedframeConfig.defaults());
    }

    public static GedcomParser ofText(String text, GedframeConfig config) {
        return new GedcomParser(null, text, config);
    }

    private String readSource() {
        if (text != null) {
            return text;
        }
        try {
            String content = Files.readString(path, StandardCharsets.UTF_8);
            if (content.startsWith("\uFEFF")) {
                content = content.substring(1);
            }
            return content;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read GEDCOM file " + path, e);
        }
    }

    /**
     * Checks that no line is nested more than one level below the previous one.
     * Only levels are checked, not tags or values.
     */
    public VerificationResult verify() {
        return GedcomVerifier.verify(readSource());
    }

    public ParseResult parse() {
        reset();
        List<GedcomLine> lines = GedcomLineTokenizer.tokenizeAll(readSource());
        for (GedcomElement root : GedcomTreeBuilder.build(lines)) {
            dispatch(root);
        }
        return snapshot();
    }

    private void reset() {
        head = null;
        individuals.clear();
        families.clear();
        sources.clear();
        objects.clear();
        repositories.clear();
    }

    private void dispatch(GedcomElement root) {
        Optional<RecordType> type = RecordType.fromTag(root.getTag());
        if (type.isEmpty()) {
            if (!GedcomTag.TRLR.matches(root.getTag())) {
                System.err.println("[GedcomParser] Skipping unsupported top-level record: " + root);
            }
            return;
        }

        switch (type.get()) {
            case HEAD -> head = new GedcomHead(root);
            case INDIVIDUAL -> individuals.add(new GedcomIndividual(root));
            case FAMILY -> families.add(new GedcomFamily(root));
            case SOURCE -> sources.add(new GedcomSource(root));
            case OBJECT -> objects.add(new GedcomObject(root));
            case REPOSITORY -> repositories.add(new GedcomRepository(root));
        }
    }

    private ParseResult snapshot() {
        return new ParseResult(head,
                new ArrayList<>(individuals),
                new ArrayList<>(families),
                new ArrayList<>(sources),
                new ArrayList<>(objects),
                new ArrayList<>(repositories));
    }

    public GedcomStats getStats() {
        GedcomStats stats = new GedcomStats();
        stats.head = head != null ? "OK" : "None";
        stats.individuals = individuals.size();
        stats.families = families.size();
        stats.sources = sources.size();
        stats.objects = objects.size();
        stats.repositories = repositories.size();
        return stats;
    }

    public String export(String format) {
        return export(format, true);
    }

    /**
     * @param format      {@code "json"} or {@code "gedcom"}
     * @param emptyFields whether absent fields and empty collections are written (JSON only)
     * @throws org.dxworks.gedframe.exception.UnsupportedFormatException for any other format
     */
    public String export(String format, boolean emptyFields) {
        return export(ExportFormat.fromName(format), emptyFields);
    }

    public String export(ExportFormat format, boolean emptyFields) {
        return exporterFor(format).export(snapshot(), emptyFields);
    }

    private GedcomExporter exporterFor(ExportFormat format) {
        return switch (format) {
            case JSON -> new JsonExporter(config.isPrettyPrint());
            case GEDCOM -> new GedcomTextExporter();
        };
    }

    public Optional<GedcomHead> getHead() {
        return Optional.ofNullable(head);
    }

    public List<GedcomIndividual> getIndividuals() {
        return List.copyOf(individuals);
    }

    public List<GedcomFamily> getFamilies() {
        return List.copyOf(families);
    }

    public Optional<GedcomIndividual> findIndividual(String xref) {
        return findRecord(individuals, xref);
    }

    public Optional<GedcomFamily> findFamily(String xref) {
        return findRecord(families, xref);
    }

    public Optional<GedcomSource> findSource(String xref) {
        return findRecord(sources, xref);
    }

    public Optional<GedcomObject> findObject(String xref) {
        return findRecord(objects, xref);
    }

    public Optional<GedcomRepository> findRepository(String xref) {
        return findRecord(repositories, xref);
    }

    private static <T extends GedcomRecord<?>> Optional<T> findRecord(List<T> collection, String xref) {
        return collection.stream()
                .filter(record -> record.getXref().equals(xref))
                .findFirst();
    }

    /**
     * Husband and wife of every family listing {@code individual} as a child.
     * References that do not resolve to a parsed individual are left out.
     */
    public List<GedcomIndividual> getParents(GedcomIndividual individual) {
        List<GedcomIndividual> parents = new ArrayList<>();
        for (GedcomFamily family : families) {
            if (family.getChildren().contains(individual.getXref())) {
                for (String parent : family.getParents()) {
                    findIndividual(parent).ifPresent(parents::add);
                }
            }
        }
        return parents;
    }

    /**
     * Children of every family where {@code individual} is husband or wife.
     * References that do not resolve to a parsed individual are left out.
     */
    public List<GedcomIndividual> getChildren(GedcomIndividual individual) {
        List<GedcomIndividual> children = new ArrayList<>();
        for (GedcomFamily family : families) {
            if (family.getParents().contains(individual.getXref())) {
                for (String child : family.getChildren()) {
                    findIndividual(child).ifPresent(children::add);
                }
            }
        }
        return children;
    }

    /**
     * Removes the individual and blanks every husband or wife reference to it.
     * Child references are kept.
     */
    public void removeIndividual(String xref) {
        individuals.removeIf(individual -> individual.getXref().equals(xref));
        for (GedcomFamily family : families) {
            family.clearSpouse(xref);
        }
    }
}
