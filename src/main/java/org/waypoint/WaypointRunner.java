package org.waypoint;

import lombok.SneakyThrows;
import org.waypoint.configuration.ConfigurationManager;
import org.waypoint.server.WaypointHttp;
import org.waypoint.server.dto.ServerProperties;

public class WaypointRunner {

    @SneakyThrows
    public static void main(String[] args) {
        if (args.length > 0) {
            ConfigurationManager.overrideProperties(args[0]);
        }

        ServerProperties serverProperties = ServerProperties.initialize();
        new WaypointHttp(serverProperties).start();
    }

}
