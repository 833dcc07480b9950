package org.dxworks.gedframe.element.sub;

import org.dxworks.gedframe.element.GedcomElement;
import org.dxworks.gedframe.element.GedcomStructure;
import org.dxworks.gedframe.model.DateData;

import java.util.Optional;
import java.util.StringJoiner;

/**
 * A DATE value split into day, month and year by token count:
 * {@code "15 MAR 2023"} is day, month and year, {@code "MAR 2025"} is month and year,
 * {@code "2023"} is year only. Values of any other shape are kept as text with no parts.
 */
public class GedcomDate extends GedcomStructure<DateData> {
    private final String day;
    private final String month;
    private final String year;
    private final boolean recognized;

    public GedcomDate(GedcomElement element) {
        super(element);
        String[] tokens = element.getValue().split(" ", -1);
        if (element.getValue().isEmpty()) {
            tokens = new String[0];
        }

        switch (tokens.length) {
            case 3 -> {
                day = tokens[0];
                month = tokens[1];
                year = tokens[2];
            }
            case 2 -> {
                day = null;
                month = tokens[0];
                year = tokens[1];
            }
            case 1 -> {
                day = null;
                month = null;
                year = tokens[0];
            }
            default -> {
                day = null;
                month = null;
                year = null;
            }
        }
        recognized = tokens.length >= 1 && tokens.length <= 3;
    }

    public static GedcomDate from(GedcomElement element) {
        return new GedcomDate(element);
    }

    public Optional<String> getDay() {
        return Optional.ofNullable(day);
    }

    public Optional<String> getMonth() {
        return Optional.ofNullable(month);
    }

    public Optional<String> getYear() {
        return Optional.ofNullable(year);
    }

    public boolean isRecognized() {
        return recognized;
    }

    @Override
    public DateData getData() {
        DateData data = new DateData();
        data.value = element.getValue();
        data.day = day;
        data.month = month;
        data.year = year;
        return data;
    }

    /**
     * The date rebuilt from its parts, or the raw value when it was not recognized.
     */
    @Override
    public String toString() {
        if (!recognized) {
            return element.getValue();
        }
        StringJoiner joiner = new StringJoiner(" ");
        getDay().ifPresent(joiner::add);
        getMonth().ifPresent(joiner::add);
        getYear().ifPresent(joiner::add);
        return joiner.toString();
    }
}
