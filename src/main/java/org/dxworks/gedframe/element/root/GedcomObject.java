package org.dxworks.gedframe.element.root;

import org.dxworks.gedframe.element.GedcomElement;
import org.dxworks.gedframe.element.GedcomTag;
import org.dxworks.gedframe.model.ObjectData;

import java.util.Optional;

/**
 * A multimedia OBJE record. FORM and TITL are read under FILE first, then directly
 * under the record (older GEDCOM layout).
 */
public class GedcomObject extends GedcomRecord<ObjectData> {
    private final String file;
    private final String format;
    private final String title;

    public GedcomObject(GedcomElement element) {
        super(element);
        Optional<GedcomElement> fileElement = element.findFirst(GedcomTag.FILE);
        this.file = fileElement.map(GedcomElement::getValue).orElse(null);
        this.format = fileElement.flatMap(f -> f.firstValue(GedcomTag.FORM))
                .or(() -> firstValue(GedcomTag.FORM))
                .orElse(null);
        this.title = fileElement.flatMap(f -> f.firstValue(GedcomTag.TITL))
                .or(() -> firstValue(GedcomTag.TITL))
                .orElse(null);
    }

    public Optional<String> getFile() {
        return Optional.ofNullable(file);
    }

    public Optional<String> getFormat() {
        return Optional.ofNullable(format);
    }

    public Optional<String> getTitle() {
        return Optional.ofNullable(title);
    }

    @Override
    public ObjectData getData() {
        ObjectData data = new ObjectData();
        data.file = file;
        data.format = format;
        data.title = title;
        return data;
    }
}
