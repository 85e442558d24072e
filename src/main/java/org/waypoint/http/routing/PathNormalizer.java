package org.waypoint.http.routing;

public final class PathNormalizer {

    private PathNormalizer() {
    }

    public static String normalize(String path) {
        if (path.endsWith("/")) {
            return path;
        }
        return path + "/";
    }

}
