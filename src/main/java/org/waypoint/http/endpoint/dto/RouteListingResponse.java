package org.waypoint.http.endpoint.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RouteListingResponse {

    private int numberOfRoutes;
    private List<RouteInfo> routes;

    public record RouteInfo(String method, String path, String controller) { }

}
