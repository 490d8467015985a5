package org.moviegraph.utils;

import java.util.UUID;

public final class AppUtils {

    private AppUtils() {
    }

    public static String generateUUID() {
        return UUID.randomUUID().toString();
    }
}
