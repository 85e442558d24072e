package org.waypoint.http.routing;

/**
 * Groups related route actions. The router only uses a controller as an identity token
 * for resolving the default of routes registered without one.
 */
public interface Controller {

    default String name() {
        return getClass().getSimpleName();
    }

}
