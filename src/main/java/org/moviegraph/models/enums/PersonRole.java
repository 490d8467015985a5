package org.moviegraph.models.enums;

import lombok.Getter;

@Getter
public enum PersonRole {
    BOTH(0, "Cast and Crew Member"),
    CAST(1, "Cast Member"),
    CREW(2, "Crew Member");

    private final int id;
    private final String label;

    PersonRole(int id, String label) {
        this.id = id;
        this.label = label;
    }

    /**
     * @return the role for the given presence flags, or {@code null} when the person is in neither
     */
    public static PersonRole of(boolean inCast, boolean inCrew) {
        if (inCast && inCrew) {
            return BOTH;
        }
        if (inCast) {
            return CAST;
        }
        if (inCrew) {
            return CREW;
        }
        return null;
    }
}
