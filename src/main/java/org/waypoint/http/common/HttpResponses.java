package org.waypoint.http.common;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import lombok.SneakyThrows;

import java.util.Arrays;
import java.util.stream.Collectors;

public final class HttpResponses {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private HttpResponses() {
    }

    @SneakyThrows
    public static FullHttpResponse json(HttpResponseStatus status, Object message, String allowedOrigin) {
        byte[] jsonBytes = objectMapper.writeValueAsBytes(message);
        FullHttpResponse response = new DefaultFullHttpResponse(
                HttpVersion.HTTP_1_1,
                status,
                Unpooled.copiedBuffer(jsonBytes)
        );
        addCorsHeaders(response, allowedOrigin);
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, "application/json; charset=UTF-8");
        response.headers().set(HttpHeaderNames.CONTENT_LENGTH, jsonBytes.length);
        return response;
    }

    public static FullHttpResponse preflight(String allowedOrigin) {
        FullHttpResponse response = new DefaultFullHttpResponse(
                HttpVersion.HTTP_1_1,
                HttpResponseStatus.OK,
                Unpooled.EMPTY_BUFFER
        );
        addCorsHeaders(response, allowedOrigin);
        response.headers().set(HttpHeaderNames.ACCESS_CONTROL_ALLOW_METHODS, Arrays.stream(HttpMethod.values())
                .map(Enum::name)
                .collect(Collectors.joining(", ")));
        response.headers().set(HttpHeaderNames.ACCESS_CONTROL_ALLOW_HEADERS, "Content-Type, Authorization");
        response.headers().set(HttpHeaderNames.CONTENT_LENGTH, 0);
        return response;
    }

    public static void send(ChannelHandlerContext ctx, FullHttpResponse response) {
        ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
    }

    private static void addCorsHeaders(FullHttpResponse response, String allowedOrigin) {
        response.headers().set(HttpHeaderNames.ACCESS_CONTROL_ALLOW_ORIGIN, allowedOrigin);
        response.headers().set(HttpHeaderNames.ACCESS_CONTROL_ALLOW_CREDENTIALS, "true");
    }

}
