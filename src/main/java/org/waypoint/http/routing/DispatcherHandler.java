package org.waypoint.http.routing;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpResponseStatus;
import lombok.extern.slf4j.Slf4j;
import org.waypoint.http.common.HttpMethod;
import org.waypoint.http.common.HttpResponses;
import org.waypoint.http.endpoint.dto.ErrorResponse;

import java.util.Optional;

/**
 * Serves requests from the tables of a {@link Router}. The first route registered for the
 * request method and path handles the request and writes its own response.
 */
@Slf4j
public class DispatcherHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private final Router<FullHttpRequest, ChannelHandlerContext> router;
    private final String allowedOrigin;

    public DispatcherHandler(Router<FullHttpRequest, ChannelHandlerContext> router, String allowedOrigin) {
        this.router = router;
        this.allowedOrigin = allowedOrigin;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
        String method = request.method().name();
        Optional<RouteEntry<FullHttpRequest, ChannelHandlerContext>> route = router.findRoute(request.uri(), method);

        if (route.isEmpty()) {
            if (HttpMethod.OPTIONS.name().equals(method)) {
                HttpResponses.send(ctx, HttpResponses.preflight(allowedOrigin));
                return;
            }
            log.debug("No route for {} {}", method, request.uri());
            HttpResponses.send(ctx, HttpResponses.json(HttpResponseStatus.NOT_FOUND,
                    new ErrorResponse("NOT_FOUND", "Unknown endpoint"), allowedOrigin));
            return;
        }

        RouteEntry<FullHttpRequest, ChannelHandlerContext> entry = route.get();
        try {
            entry.action().handle(request, ctx);
        } catch (Exception e) {
            log.error("Action of {} failed for {} {}", entry.controller().name(), method, request.uri(), e);
            HttpResponses.send(ctx, HttpResponses.json(HttpResponseStatus.INTERNAL_SERVER_ERROR,
                    new ErrorResponse("ERROR", "Internal error: " + e.getMessage()), allowedOrigin));
        }
    }

}
