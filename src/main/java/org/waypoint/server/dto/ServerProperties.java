package org.waypoint.server.dto;

import lombok.Builder;
import lombok.Data;
import org.waypoint.configuration.ConfigurationManager;

@Data
@Builder
public class ServerProperties {

    private int port;
    private int maxContentLength;
    private String allowedOrigin;
    private String systemBasePath;

    public static ServerProperties initialize() {
        return from(ConfigurationManager.getINSTANCE());
    }

    public static ServerProperties from(ConfigurationManager config) {
        return ServerProperties.builder()
                .port(config.getIntProperty("waypoint.server.port", 8080))
                .maxContentLength(config.getIntProperty("waypoint.server.maxContentLength", 512 * 1024))
                .allowedOrigin(config.getProperty("waypoint.cors.allowedOrigin", "*"))
                .systemBasePath(config.getProperty("waypoint.system.basePath", "system"))
                .build();
    }

}
