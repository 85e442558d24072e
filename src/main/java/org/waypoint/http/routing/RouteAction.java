package org.waypoint.http.routing;

/**
 * Handler bound to a route. Invoked by the dispatcher with the transport request and response handles.
 *
 * @param <Q> request handle type
 * @param <S> response handle type
 */
@FunctionalInterface
public interface RouteAction<Q, S> {

    void handle(Q request, S response) throws Exception;

}
