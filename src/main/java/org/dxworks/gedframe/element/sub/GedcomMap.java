package org.dxworks.gedframe.element.sub;

import org.dxworks.gedframe.element.GedcomElement;
import org.dxworks.gedframe.element.GedcomStructure;
import org.dxworks.gedframe.element.GedcomTag;
import org.dxworks.gedframe.model.MapData;

import java.util.Optional;

public class GedcomMap extends GedcomStructure<MapData> {
    private final String latitude;
    private final String longitude;

    public GedcomMap(GedcomElement element) {
        super(element);
        this.latitude = firstValue(GedcomTag.LATI).orElse(null);
        this.longitude = firstValue(GedcomTag.LONG).orElse(null);
    }

    public static GedcomMap from(GedcomElement element) {
        return new GedcomMap(element);
    }

    public Optional<String> getLatitude() {
        return Optional.ofNullable(latitude);
    }

    public Optional<String> getLongitude() {
        return Optional.ofNullable(longitude);
    }

    @Override
    public MapData getData() {
        MapData data = new MapData();
        data.latitude = latitude;
        data.longitude = longitude;
        return data;
    }

    @Override
    public String toString() {
        return "Map: " + latitude + ", " + longitude;
    }
}
