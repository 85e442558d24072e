package org.waypoint.http.routing;

import java.util.regex.Pattern;

public final class PathValidator {

    private static final Pattern ROUTE_PATH = Pattern.compile("(\\w+/)*\\w+/?");

    private PathValidator() {
    }

    /**
     * Word segments separated by single slashes, with an optional trailing slash.
     * No leading slash, no empty segments.
     */
    public static boolean isValid(String path) {
        return path != null && ROUTE_PATH.matcher(path).matches();
    }

}
