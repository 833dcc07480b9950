package org.dxworks.gedframe.element.sub;

import org.dxworks.gedframe.element.GedcomElement;
import org.dxworks.gedframe.element.GedcomStructure;
import org.dxworks.gedframe.element.GedcomTag;
import org.dxworks.gedframe.model.PlaceData;

import java.util.Optional;

/**
 * A PLAC structure: the place name is the line value, coordinates hang off its MAP child.
 */
public class GedcomPlace extends GedcomStructure<PlaceData> {
    private final String form;
    private final GedcomMap map;

    public GedcomPlace(GedcomElement element) {
        super(element);
        this.form = firstValue(GedcomTag.FORM).orElse(null);
        this.map = element.findFirst(GedcomTag.MAP).map(GedcomMap::from).orElse(null);
    }

    public static GedcomPlace from(GedcomElement element) {
        return new GedcomPlace(element);
    }

    public String getName() {
        return element.getValue();
    }

    public Optional<String> getForm() {
        return Optional.ofNullable(form);
    }

    public Optional<GedcomMap> getMap() {
        return Optional.ofNullable(map);
    }

    @Override
    public PlaceData getData() {
        PlaceData data = new PlaceData();
        data.name = getName();
        data.form = form;
        data.map = dataOrNull(getMap());
        return data;
    }

    @Override
    public String toString() {
        return getName();
    }
}
