package org.waypoint.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.waypoint.http.routing.Controller;
import org.waypoint.http.routing.DispatcherHandler;
import org.waypoint.http.routing.RouteEntry;
import org.waypoint.http.routing.Router;
import org.waypoint.server.dto.ServerProperties;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class WaypointHttpTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ServerProperties properties = ServerProperties.builder()
            .port(0)
            .maxContentLength(1024)
            .allowedOrigin("http://localhost:3000")
            .systemBasePath("system")
            .build();

    private Router<FullHttpRequest, ChannelHandlerContext> router;
    private EmbeddedChannel channel;

    @BeforeEach
    void setUp() {
        router = new Router<>();
        router.get("ping", (request, ctx) -> { }, new Controller() { });
        new WaypointHttp(router, properties).mountSystemRoutes();
        channel = new EmbeddedChannel(new DispatcherHandler(router, properties.getAllowedOrigin()));
    }

    @AfterEach
    void tearDown() {
        channel.finishAndReleaseAll();
    }

    @Test
    void system_routes_are_mounted_under_system_base_path() {
        assertThat(router.getRoutes().entries())
                .extracting(RouteEntry::path)
                .containsExactly("ping/", "/system/heartbeat/", "/system/routes/");
    }

    @Test
    void heartbeat_answers_ok() {
        FullHttpResponse response = get("/system/heartbeat");

        assertThat(response.status()).isEqualTo(HttpResponseStatus.OK);
        assertThat(response.content().toString(StandardCharsets.UTF_8)).isEqualTo("\"OK\"");
        response.release();
    }

    @Test
    void routes_lists_every_registered_route() throws Exception {
        FullHttpResponse response = get("/system/routes");

        JsonNode body = objectMapper.readTree(response.content().toString(StandardCharsets.UTF_8));
        assertThat(body.get("numberOfRoutes").asInt()).isEqualTo(3);
        assertThat(body.get("routes").get(1).get("path").asText()).isEqualTo("/system/heartbeat/");
        assertThat(body.get("routes").get(1).get("controller").asText()).isEqualTo("HealthController");
        assertThat(body.get("routes").get(1).get("method").asText()).isEqualTo("GET");
        response.release();
    }

    private FullHttpResponse get(String uri) {
        channel.writeInbound(new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.GET, uri));
        return channel.readOutbound();
    }

}
