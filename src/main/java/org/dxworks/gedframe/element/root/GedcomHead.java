package org.dxworks.gedframe.element.root;

import org.dxworks.gedframe.element.GedcomElement;
import org.dxworks.gedframe.element.GedcomTag;
import org.dxworks.gedframe.element.sub.GedcomDate;
import org.dxworks.gedframe.model.HeadData;

import java.util.Optional;

public class GedcomHead extends GedcomRecord<HeadData> {
    private final String source;
    private final String destination;
    private final GedcomDate date;
    private final String charset;
    private final String gedcomVersion;
    private final String submitter;

    public GedcomHead(GedcomElement element) {
        super(element);
        this.source = firstValue(GedcomTag.SOUR).orElse(null);
        this.destination = firstValue(GedcomTag.DEST).orElse(null);
        this.date = element.findFirst(GedcomTag.DATE).map(GedcomDate::from).orElse(null);
        this.charset = firstValue(GedcomTag.CHAR).orElse(null);
        this.gedcomVersion = element.findFirst(GedcomTag.GEDC)
                .flatMap(gedc -> gedc.firstValue(GedcomTag.VERS))
                .orElse(null);
        this.submitter = firstValue(GedcomTag.SUBM).orElse(null);
    }

    public Optional<String> getSource() {
        return Optional.ofNullable(source);
    }

    public Optional<String> getCharset() {
        return Optional.ofNullable(charset);
    }

    public Optional<String> getGedcomVersion() {
        return Optional.ofNullable(gedcomVersion);
    }

    public Optional<GedcomDate> getDate() {
        return Optional.ofNullable(date);
    }

    @Override
    public HeadData getData() {
        HeadData data = new HeadData();
        data.source = source;
        data.destination = destination;
        data.date = dataOrNull(getDate());
        data.charset = charset;
        data.gedcomVersion = gedcomVersion;
        data.submitter = submitter;
        return data;
    }
}
