package org.dxworks.gedframe.element.sub;

import org.dxworks.gedframe.element.GedcomElement;
import org.dxworks.gedframe.element.GedcomStructure;
import org.dxworks.gedframe.element.GedcomTag;
import org.dxworks.gedframe.model.EventData;

import java.util.Optional;

/**
 * Common event detail shared by BIRT, DEAT, MARR and DIV.
 */
public class GedcomEvent extends GedcomStructure<EventData> {
    private final GedcomDate date;
    private final GedcomPlace place;
    private final String type;
    private final String age;
    private final String cause;

    public GedcomEvent(GedcomElement element) {
        super(element);
        this.date = element.findFirst(GedcomTag.DATE).map(GedcomDate::from).orElse(null);
        this.place = element.findFirst(GedcomTag.PLAC).map(GedcomPlace::from).orElse(null);
        this.type = firstValue(GedcomTag.TYPE).orElse(null);
        this.age = firstValue(GedcomTag.AGE).orElse(null);
        this.cause = firstValue(GedcomTag.CAUS).orElse(null);
    }

    public static GedcomEvent from(GedcomElement element) {
        return new GedcomEvent(element);
    }

    public Optional<GedcomDate> getDate() {
        return Optional.ofNullable(date);
    }

    public Optional<GedcomPlace> getPlace() {
        return Optional.ofNullable(place);
    }

    public Optional<String> getType() {
        return Optional.ofNullable(type);
    }

    public Optional<String> getAge() {
        return Optional.ofNullable(age);
    }

    public Optional<String> getCause() {
        return Optional.ofNullable(cause);
    }

    @Override
    public EventData getData() {
        EventData data = new EventData();
        data.date = dataOrNull(getDate());
        data.place = dataOrNull(getPlace());
        data.type = type;
        data.age = age;
        data.cause = cause;
        return data;
    }

    @Override
    public String toString() {
        return getTag() + getDate().map(d -> " " + d).orElse("");
    }
}
