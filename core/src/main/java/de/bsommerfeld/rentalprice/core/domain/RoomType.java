package de.bsommerfeld.rentalprice.core.domain;

import java.util.Locale;

/**
 * Listing room type as published by the rental platform.
 */
public enum RoomType {

    ENTIRE_HOME("Entire home/apt"),
    PRIVATE_ROOM("Private room"),
    SHARED_ROOM("Shared room");

    private final String label;

    RoomType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Resolves a room type from its platform label or constant name,
     * ignoring case.
     *
     * @throws IllegalArgumentException if the label matches no room type
     */
    public static RoomType fromLabel(String label) {
        if (label == null)
            throw new IllegalArgumentException("Room type label must not be null");
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        for (RoomType type : values()) {
            if (type.label.toLowerCase(Locale.ROOT).equals(normalized)
                    || type.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown room type: " + label);
    }
}
