package org.moviegraph.models.enums;

import lombok.Getter;

@Getter
public enum Gender {
    NOT_SPECIFIED(0, "Not Specified"),
    FEMALE(1, "Female"),
    MALE(2, "Male");

    private final int id;
    private final String label;

    Gender(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public static boolean isPlaceholder(Integer genderId) {
        return genderId == null || genderId == NOT_SPECIFIED.id;
    }
}
