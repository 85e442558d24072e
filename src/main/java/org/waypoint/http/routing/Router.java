package org.waypoint.http.routing;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.waypoint.exception.InvalidRouteException;
import org.waypoint.http.common.HttpMethod;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Fluent route table builder. Every registration call mutates the router and returns it,
 * so setup code can chain calls:
 *
 * <pre>
 * router.on("api")
 *       .use(widgetController)
 *       .get("widgets", widgetController::list)
 *       .post("widgets", widgetController::create);
 * </pre>
 *
 * A route registered with an explicit controller makes that controller the default for all
 * later registrations. A base path set with {@link #on(String)} applies only to routes
 * registered after it. The router is not thread safe; register routes before handing it
 * to the dispatcher.
 *
 * @param <Q> request handle type passed to route actions
 * @param <S> response handle type passed to route actions
 */
@Slf4j
public class Router<Q, S> {

    private final Map<HttpMethod, RouteTable<Q, S>> tables = new EnumMap<>(HttpMethod.class);

    @Getter
    private String basePath;
    @Getter
    private Controller defaultController;

    public Router() {
        for (HttpMethod method : HttpMethod.values()) {
            tables.put(method, new RouteTable<>());
        }
    }

    public Router(String basePath, Controller defaultController) {
        this();
        if (basePath != null) {
            on(basePath);
        }
        this.defaultController = defaultController;
    }

    public Router<Q, S> get(String path, RouteAction<Q, S> action) {
        return register(HttpMethod.GET, path, action, null);
    }

    public Router<Q, S> get(String path, RouteAction<Q, S> action, Controller controller) {
        return register(HttpMethod.GET, path, action, controller);
    }

    public Router<Q, S> post(String path, RouteAction<Q, S> action) {
        return register(HttpMethod.POST, path, action, null);
    }

    public Router<Q, S> post(String path, RouteAction<Q, S> action, Controller controller) {
        return register(HttpMethod.POST, path, action, controller);
    }

    public Router<Q, S> put(String path, RouteAction<Q, S> action) {
        return register(HttpMethod.PUT, path, action, null);
    }

    public Router<Q, S> put(String path, RouteAction<Q, S> action, Controller controller) {
        return register(HttpMethod.PUT, path, action, controller);
    }

    public Router<Q, S> patch(String path, RouteAction<Q, S> action) {
        return register(HttpMethod.PATCH, path, action, null);
    }

    public Router<Q, S> patch(String path, RouteAction<Q, S> action, Controller controller) {
        return register(HttpMethod.PATCH, path, action, controller);
    }

    public Router<Q, S> delete(String path, RouteAction<Q, S> action) {
        return register(HttpMethod.DELETE, path, action, null);
    }

    public Router<Q, S> delete(String path, RouteAction<Q, S> action, Controller controller) {
        return register(HttpMethod.DELETE, path, action, controller);
    }

    public Router<Q, S> options(String path, RouteAction<Q, S> action) {
        return register(HttpMethod.OPTIONS, path, action, null);
    }

    public Router<Q, S> options(String path, RouteAction<Q, S> action, Controller controller) {
        return register(HttpMethod.OPTIONS, path, action, controller);
    }

    /**
     * Validates and normalizes {@code path}, resolves the controller and appends the route
     * to the table of {@code method}.
     *
     * @param controller explicit controller, or {@code null} to use the current default
     * @throws InvalidRouteException if the path is invalid or no controller can be resolved
     */
    public Router<Q, S> register(HttpMethod method, String path, RouteAction<Q, S> action, Controller controller) {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(action, "action");
        if (!PathValidator.isValid(path)) {
            log.warn("Rejected {} route with invalid path '{}'", method, path);
            throw new InvalidRouteException("The path '" + path + "' is an invalid route path");
        }
        String formattedPath = PathNormalizer.normalize(path);

        if (controller != null) {
            defaultController = controller;
        }
        if (defaultController == null) {
            log.warn("Rejected {} route '{}': no controller given and no default set", method, formattedPath);
            throw new InvalidRouteException(
                    "Null controller for route '" + method + " " + formattedPath + "' is not allowed.");
        }

        String finalPath = basePath == null ? formattedPath : prependBasePath(formattedPath);
        tableFor(method).add(new RouteEntry<>(finalPath, defaultController, action));
        log.debug("Registered {} {} -> {}", method, finalPath, defaultController.name());
        return this;
    }

    /**
     * Sets the base path prepended to every route registered from now on.
     * Routes registered earlier keep their paths.
     *
     * @throws InvalidRouteException if {@code path} is {@code "/"} or not a valid route path
     */
    public Router<Q, S> on(String path) {
        if ("/".equals(path) || !PathValidator.isValid(path)) {
            throw new InvalidRouteException("The path '" + path + "' is an invalid route path");
        }
        basePath = "/" + PathNormalizer.normalize(path);
        log.debug("Base path set to {}", basePath);
        return this;
    }

    /**
     * Mounts {@code controller} as the default for routes under the current base path.
     *
     * @throws InvalidRouteException if no base path is set
     */
    public Router<Q, S> use(Controller controller) {
        if (basePath == null) {
            throw new InvalidRouteException("Controller mount attempted without a set base path.");
        }
        defaultController = controller;
        log.debug("Controller {} mounted on {}", controller == null ? null : controller.name(), basePath);
        return this;
    }

    String prependBasePath(String path) {
        return basePath + path;
    }

    public RouteTable<Q, S> routes(HttpMethod method) {
        return tableFor(method);
    }

    public RouteTable<Q, S> getRoutes() {
        return tableFor(HttpMethod.GET);
    }

    public RouteTable<Q, S> postRoutes() {
        return tableFor(HttpMethod.POST);
    }

    public RouteTable<Q, S> putRoutes() {
        return tableFor(HttpMethod.PUT);
    }

    public RouteTable<Q, S> patchRoutes() {
        return tableFor(HttpMethod.PATCH);
    }

    public RouteTable<Q, S> deleteRoutes() {
        return tableFor(HttpMethod.DELETE);
    }

    public RouteTable<Q, S> optionsRoutes() {
        return tableFor(HttpMethod.OPTIONS);
    }

    public int routeCount() {
        return tables.values().stream().mapToInt(RouteTable::size).sum();
    }

    /**
     * Try to find a matching route for the given URI and HTTP method.
     * Returns an Optional with the first registered match, otherwise empty.
     */
    public Optional<RouteEntry<Q, S>> findRoute(String uri, String httpMethod) {
        return HttpMethod.from(httpMethod)
                .flatMap(method -> tableFor(method).find(uri));
    }

    private RouteTable<Q, S> tableFor(HttpMethod method) {
        RouteTable<Q, S> table = tables.get(method);
        if (table == null) {
            log.error("No route table wired for HTTP method '{}'", method);
            throw new IllegalStateException("Unrecognized HTTP method: '" + method + "'");
        }
        return table;
    }

}
