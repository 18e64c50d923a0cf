package de.bsommerfeld.rentalprice.core.domain;

import java.time.Month;

/**
 * Meteorological seasons, mapped for the Southern Hemisphere.
 */
public enum Season {

    SUMMER("summer"),
    AUTUMN("autumn"),
    WINTER("winter"),
    SPRING("spring");

    private final String label;

    Season(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Dec–Feb summer, Mar–May autumn, Jun–Aug winter, Sep–Nov spring.
     */
    public static Season of(Month month) {
        switch (month) {
            case DECEMBER:
            case JANUARY:
            case FEBRUARY:
                return SUMMER;
            case MARCH:
            case APRIL:
            case MAY:
                return AUTUMN;
            case JUNE:
            case JULY:
            case AUGUST:
                return WINTER;
            default:
                return SPRING;
        }
    }
}
