package org.dxworks.gedframe.parser;

import org.dxworks.gedframe.element.root.GedcomFamily;
import org.dxworks.gedframe.element.root.GedcomHead;
import org.dxworks.gedframe.element.root.GedcomIndividual;
import org.dxworks.gedframe.element.root.GedcomObject;
import org.dxworks.gedframe.element.root.GedcomRepository;
import org.dxworks.gedframe.element.root.GedcomSource;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the top-level collections produced by one parse.
 */
public class ParseResult {
    private final GedcomHead head;
    private final List<GedcomIndividual> individuals;
    private final List<GedcomFamily> families;
    private final List<GedcomSource> sources;
    private final List<GedcomObject> objects;
    private final List<GedcomRepository> repositories;

    public ParseResult(GedcomHead head,
                       List<GedcomIndividual> individuals,
                       List<GedcomFamily> families,
                       List<GedcomSource> sources,
                       List<GedcomObject> objects,
                       List<GedcomRepository> repositories) {
        this.head = head;
        this.individuals = Collections.unmodifiableList(individuals);
        this.families = Collections.unmodifiableList(families);
        this.sources = Collections.unmodifiableList(sources);
        this.objects = Collections.unmodifiableList(objects);
        this.repositories = Collections.unmodifiableList(repositories);
    }

    public Optional<GedcomHead> getHead() {
        return Optional.ofNullable(head);
    }

    public int getHeadCount() {
        return head != null ? 1 : 0;
    }

    public List<GedcomIndividual> getIndividuals() {
        return individuals;
    }

    public List<GedcomFamily> getFamilies() {
        return families;
    }

    public List<GedcomSource> getSources() {
        return sources;
    }

    public List<GedcomObject> getObjects() {
        return objects;
    }

    public List<GedcomRepository> getRepositories() {
        return repositories;
    }
}
