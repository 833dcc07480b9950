package org.dxworks.gedframe.element.sub;

import org.dxworks.gedframe.element.GedcomElement;
import org.dxworks.gedframe.model.EventData;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.dxworks.gedframe.TestUtils.element;

class GedcomEventTest {

    @Test
    void readsDatePlaceAndDetails() {
        GedcomEvent death = GedcomEvent.from(element(
                "1 DEAT",
                "2 DATE 1932",
                "2 PLAC Leeds, Yorkshire, England",
                "2 AGE 71y",
                "2 CAUS Pneumonia",
                "2 TYPE Natural"));

        assertThat(death.getDate()).map(GedcomDate::toString).contains("1932");
        assertThat(death.getPlace()).map(GedcomPlace::getName).contains("Leeds, Yorkshire, England");
        assertThat(death.getAge()).contains("71y");
        assertThat(death.getCause()).contains("Pneumonia");
        assertThat(death.getType()).contains("Natural");
    }

    @Test
    void missingDetailsAreAbsent() {
        GedcomEvent birth = GedcomEvent.from(element("1 BIRT"));

        assertThat(birth.getDate()).isEmpty();
        assertThat(birth.getPlace()).isEmpty();

        EventData data = birth.getData();
        assertThat(data.date).isNull();
        assertThat(data.place).isNull();
        assertThat(data.cause).isNull();
    }

    @Test
    void wrappingKeepsParsedChildren() {
        GedcomElement element = element(
                "1 BIRT",
                "2 DATE 3 APR 1861",
                "2 PLAC Leeds");

        GedcomEvent birth = GedcomEvent.from(element);

        assertThat(birth.getElement()).isSameAs(element);
        assertThat(birth.getDate().get().getElement()).isSameAs(element.getChildren().get(0));
    }

    @Test
    void placeReadsFormAndMap() {
        GedcomPlace place = GedcomPlace.from(element(
                "2 PLAC Leeds, Yorkshire, England",
                "3 FORM City, County, Country",
                "3 MAP",
                "4 LATI N53.7997",
                "4 LONG W1.5492"));

        assertThat(place.getForm()).contains("City, County, Country");
        assertThat(place.getMap()).isPresent();
        assertThat(place.getMap().get().getLatitude()).contains("N53.7997");
        assertThat(place.getMap().get().getLongitude()).contains("W1.5492");
        assertThat(place.getData().map.latitude).isEqualTo("N53.7997");
    }

    @Test
    void mapWithoutCoordinates() {
        GedcomMap map = GedcomMap.from(element("3 MAP", "4 LATI N10.0"));

        assertThat(map.getLatitude()).contains("N10.0");
        assertThat(map.getLongitude()).isEmpty();
        assertThat(map.getData().longitude).isNull();
    }
}
