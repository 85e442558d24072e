package org.waypoint.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.stream.ChunkedWriteHandler;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.waypoint.http.endpoint.controller.HealthController;
import org.waypoint.http.routing.DispatcherHandler;
import org.waypoint.http.routing.Router;
import org.waypoint.server.dto.ServerProperties;

@Slf4j
public class WaypointHttp {

    @Getter
    private final Router<FullHttpRequest, ChannelHandlerContext> router;
    private final ServerProperties properties;

    public WaypointHttp(ServerProperties properties) {
        this(new Router<>(), properties);
    }

    public WaypointHttp(Router<FullHttpRequest, ChannelHandlerContext> router, ServerProperties properties) {
        this.router = router;
        this.properties = properties;
    }

    /**
     * Mounts the health endpoints under the configured system base path. Runs last, right
     * before binding, so application routes keep whatever base path they were registered with.
     */
    void mountSystemRoutes() {
        HealthController healthController = new HealthController(router, properties.getAllowedOrigin());
        router.on(properties.getSystemBasePath())
                .use(healthController)
                .get("heartbeat", healthController::heartbeat)
                .get("routes", healthController::routes);
    }

    ChannelInitializer<Channel> channelInitializer() {
        return new ChannelInitializer<>() {
            @Override
            protected void initChannel(Channel ch) {
                ChannelPipeline pipeline = ch.pipeline();
                pipeline.addLast("codec", new HttpServerCodec());
                pipeline.addLast("aggregator", new HttpObjectAggregator(properties.getMaxContentLength()));
                pipeline.addLast("chunkedWriter", new ChunkedWriteHandler());
                pipeline.addLast("handler", new DispatcherHandler(router, properties.getAllowedOrigin()));
            }
        };
    }

    public void start() throws InterruptedException {
        mountSystemRoutes();
        EventLoopGroup bossGroup = new NioEventLoopGroup();
        EventLoopGroup workerGroup = new NioEventLoopGroup();
        try {
            ServerBootstrap bootstrap = new ServerBootstrap();
            bootstrap.group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childHandler(channelInitializer());

            ChannelFuture future = bootstrap.bind(properties.getPort()).sync();
            log.info("Serving {} routes on port {}", router.routeCount(), properties.getPort());
            future.channel().closeFuture().sync();
        } finally {
            bossGroup.shutdownGracefully();
            workerGroup.shutdownGracefully();
        }
    }

}
