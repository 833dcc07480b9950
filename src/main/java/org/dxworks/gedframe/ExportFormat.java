package org.dxworks.gedframe;

import org.dxworks.gedframe.exception.UnsupportedFormatException;

import java.util.Arrays;
import java.util.Optional;

public enum ExportFormat {
    JSON("json", "json"),
    GEDCOM("gedcom", "ged");

    private final String name;
    private final String extension;

    ExportFormat(String name, String extension) {
        this.name = name;
        this.extension = extension;
    }

    public String getName() {
        return name;
    }

    public String getExtension() {
        return extension;
    }

    public static Optional<ExportFormat> find(String name) {
        return Arrays.stream(values())
                .filter(format -> format.name.equals(name))
                .findFirst();
    }

    public static ExportFormat fromName(String name) {
        return find(name).orElseThrow(() -> new UnsupportedFormatException(name));
    }
}
