package org.dxworks.gedframe.element.root;

import org.dxworks.gedframe.element.GedcomElement;
import org.dxworks.gedframe.element.GedcomTag;
import org.dxworks.gedframe.element.sub.GedcomEvent;
import org.dxworks.gedframe.model.IndividualData;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * An INDI record.
 * <p>
 * The first name is the first word before the first {@code /}; the last name is
 * whatever sits right before the last {@code /}. Names without a slash-delimited
 * surname therefore get an empty or unexpected last name.
 */
public class GedcomIndividual extends GedcomRecord<IndividualData> {
    private static final String SURNAME_DELIMITER = "/";

    private final String name;
    private final String firstName;
    private final String lastName;
    private final GedcomEvent birth;
    private final GedcomEvent death;
    private final String sex;
    private final List<String> media;

    public GedcomIndividual(GedcomElement element) {
        super(element);
        this.name = firstValue(GedcomTag.NAME).orElse("");
        this.firstName = findFirstName(name);
        this.lastName = findLastName(name);
        this.birth = element.findFirst(GedcomTag.BIRT).map(GedcomEvent::from).orElse(null);
        this.death = element.findFirst(GedcomTag.DEAT).map(GedcomEvent::from).orElse(null);
        this.sex = firstValue(GedcomTag.SEX).orElse(null);
        this.media = element.findSubElements(GedcomTag.OBJE).stream()
                .map(GedcomElement::getValue)
                .toList();
    }

    private static String findFirstName(String name) {
        return name.split(SURNAME_DELIMITER, -1)[0].split(" ", -1)[0].trim();
    }

    private static String findLastName(String name) {
        String[] parts = name.split(SURNAME_DELIMITER, -1);
        return parts.length >= 2 ? parts[parts.length - 2].trim() : "";
    }

    public String getName() {
        return name;
    }

    public String getFirstName() {
        return firstName;
    }

    public String getLastName() {
        return lastName;
    }

    public Optional<GedcomEvent> getBirth() {
        return Optional.ofNullable(birth);
    }

    public Optional<GedcomEvent> getDeath() {
        return Optional.ofNullable(death);
    }

    public Optional<String> getSex() {
        return Optional.ofNullable(sex);
    }

    public List<String> getMedia() {
        return media;
    }

    @Override
    public IndividualData getData() {
        IndividualData data = new IndividualData();
        data.name = name;
        data.firstName = firstName;
        data.lastName = lastName;
        data.sex = sex;
        data.birth = dataOrNull(getBirth());
        data.death = dataOrNull(getDeath());
        data.media = new ArrayList<>(media);
        return data;
    }

    @Override
    public String toString() {
        return firstName + " " + lastName;
    }
}
