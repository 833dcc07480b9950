package org.dxworks.gedframe.element.root;

import org.dxworks.gedframe.element.GedcomElement;
import org.dxworks.gedframe.element.GedcomTag;
import org.dxworks.gedframe.model.SourceData;

import java.util.Optional;

public class GedcomSource extends GedcomRecord<SourceData> {
    private final String title;
    private final String author;
    private final String publication;
    private final String repository;
    private final String text;

    public GedcomSource(GedcomElement element) {
        super(element);
        this.title = firstValue(GedcomTag.TITL).orElse(null);
        this.author = firstValue(GedcomTag.AUTH).orElse(null);
        this.publication = firstValue(GedcomTag.PUBL).orElse(null);
        this.repository = firstValue(GedcomTag.REPO).orElse(null);
        this.text = firstValue(GedcomTag.TEXT).orElse(null);
    }

    public Optional<String> getTitle() {
        return Optional.ofNullable(title);
    }

    public Optional<String> getAuthor() {
        return Optional.ofNullable(author);
    }

    /** Cross-reference id of the holding repository, if any. */
    public Optional<String> getRepository() {
        return Optional.ofNullable(repository);
    }

    @Override
    public SourceData getData() {
        SourceData data = new SourceData();
        data.title = title;
        data.author = author;
        data.publication = publication;
        data.repository = repository;
        data.text = text;
        return data;
    }
}
