package de.vzg.pubmed.tools.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum IssnType {
    PRINT("Print"),
    ELECTRONIC("Electronic");

    private final String label;

    IssnType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * @param label the {@code IssnType} attribute value
     * @return the matching type
     * @throws IllegalArgumentException for anything but {@code Print} or {@code Electronic}
     */
    @JsonCreator
    public static IssnType fromLabel(String label) {
        for (IssnType type : values()) {
            if (type.label.equals(label)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown ISSN type: " + label);
    }
}
