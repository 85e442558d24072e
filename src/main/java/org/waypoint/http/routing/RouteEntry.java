package org.waypoint.http.routing;

import java.util.Objects;

public record RouteEntry<Q, S>(String path, Controller controller, RouteAction<Q, S> action) {

    public RouteEntry {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(controller, "controller");
        Objects.requireNonNull(action, "action");
    }

}
