package org.waypoint.http.routing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Routes registered for a single HTTP method, kept in registration order.
 * The same path may be registered more than once; lookups return the first registration.
 */
public class RouteTable<Q, S> implements Iterable<RouteEntry<Q, S>> {

    private final List<RouteEntry<Q, S>> entries = new ArrayList<>();

    public void add(RouteEntry<Q, S> entry) {
        entries.add(entry);
    }

    public RouteEntry<Q, S> get(int index) {
        return entries.get(index);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public List<RouteEntry<Q, S>> entries() {
        return Collections.unmodifiableList(entries);
    }

    /**
     * Finds the first route whose path equals the request path. Both sides are compared
     * without a leading slash and with a trailing one; any query string is ignored.
     */
    public Optional<RouteEntry<Q, S>> find(String requestPath) {
        if (requestPath == null) {
            return Optional.empty();
        }
        String wanted = comparable(requestPath.split("\\?", 2)[0]);
        for (RouteEntry<Q, S> entry : entries) {
            if (comparable(entry.path()).equals(wanted)) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    private static String comparable(String path) {
        String stripped = path.startsWith("/") ? path.substring(1) : path;
        return PathNormalizer.normalize(stripped);
    }

    @Override
    public Iterator<RouteEntry<Q, S>> iterator() {
        return entries().iterator();
    }

}
