package org.waypoint.http.endpoint.controller;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpResponseStatus;
import lombok.RequiredArgsConstructor;
import org.waypoint.http.common.HttpMethod;
import org.waypoint.http.common.HttpResponses;
import org.waypoint.http.endpoint.dto.RouteListingResponse;
import org.waypoint.http.routing.Controller;
import org.waypoint.http.routing.RouteEntry;
import org.waypoint.http.routing.Router;

import java.util.ArrayList;
import java.util.List;

@RequiredArgsConstructor
public class HealthController implements Controller {

    private final Router<FullHttpRequest, ChannelHandlerContext> router;
    private final String allowedOrigin;

    public void heartbeat(FullHttpRequest request, ChannelHandlerContext ctx) {
        HttpResponses.send(ctx, HttpResponses.json(HttpResponseStatus.OK, "OK", allowedOrigin));
    }

    public void routes(FullHttpRequest request, ChannelHandlerContext ctx) {
        List<RouteListingResponse.RouteInfo> routes = new ArrayList<>();
        for (HttpMethod method : HttpMethod.values()) {
            for (RouteEntry<FullHttpRequest, ChannelHandlerContext> entry : router.routes(method)) {
                routes.add(new RouteListingResponse.RouteInfo(method.name(), entry.path(), entry.controller().name()));
            }
        }
        HttpResponses.send(ctx, HttpResponses.json(HttpResponseStatus.OK,
                new RouteListingResponse(routes.size(), routes), allowedOrigin));
    }

}
