package org.dxworks.gedframe.export;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.dxworks.gedframe.element.root.GedcomFamily;
import org.dxworks.gedframe.element.root.GedcomIndividual;
import org.dxworks.gedframe.element.root.GedcomObject;
import org.dxworks.gedframe.element.root.GedcomRepository;
import org.dxworks.gedframe.element.root.GedcomSource;
import org.dxworks.gedframe.exception.GedcomException;
import org.dxworks.gedframe.model.GedcomDocument;
import org.dxworks.gedframe.parser.ParseResult;

/**
 * Structured export. Each collection becomes an object keyed by cross-reference id,
 * holding the record's {@code getData()} snapshot with snake_case keys.
 * With {@code emptyFields} off, nulls, empty strings and empty collections are left out.
 */
public class JsonExporter implements GedcomExporter {
    // shared by every exporter, never reconfigured after creation
    private static final ObjectMapper PRETTY_FULL = createMapper(true, JsonInclude.Include.ALWAYS);
    private static final ObjectMapper PRETTY_COMPACT = createMapper(true, JsonInclude.Include.NON_EMPTY);
    private static final ObjectMapper PLAIN_FULL = createMapper(false, JsonInclude.Include.ALWAYS);
    private static final ObjectMapper PLAIN_COMPACT = createMapper(false, JsonInclude.Include.NON_EMPTY);

    private final boolean prettyPrint;

    public JsonExporter(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
    }

    private static ObjectMapper createMapper(boolean prettyPrint, JsonInclude.Include inclusion) {
        ObjectMapper mapper = new ObjectMapper()
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                .setSerializationInclusion(inclusion);
        if (prettyPrint) {
            mapper.enable(SerializationFeature.INDENT_OUTPUT);
        }
        return mapper;
    }

    static ObjectMapper mapperFor(boolean prettyPrint, boolean emptyFields) {
        if (prettyPrint) {
            return emptyFields ? PRETTY_FULL : PRETTY_COMPACT;
        }
        return emptyFields ? PLAIN_FULL : PLAIN_COMPACT;
    }

    @Override
    public String export(ParseResult result, boolean emptyFields) {
        GedcomDocument document = toDocument(result);
        ObjectMapper mapper = mapperFor(prettyPrint, emptyFields);
        try {
            return mapper.writeValueAsString(document) + "\n";
        } catch (JsonProcessingException e) {
            throw new GedcomException("Failed to serialize GEDCOM data to JSON", e);
        }
    }

    public GedcomDocument toDocument(ParseResult result) {
        GedcomDocument document = new GedcomDocument();
        document.head = result.getHead().map(head -> head.getData()).orElse(null);
        for (GedcomIndividual individual : result.getIndividuals()) {
            document.individuals.put(individual.getXref(), individual.getData());
        }
        for (GedcomFamily family : result.getFamilies()) {
            document.families.put(family.getXref(), family.getData());
        }
        for (GedcomSource source : result.getSources()) {
            document.sources.put(source.getXref(), source.getData());
        }
        for (GedcomObject object : result.getObjects()) {
            document.objects.put(object.getXref(), object.getData());
        }
        for (GedcomRepository repository : result.getRepositories()) {
            document.repositories.put(repository.getXref(), repository.getData());
        }
        return document;
    }
}
