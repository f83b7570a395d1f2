package net.homeroute.domain.routing.handler;

import java.util.Map;

public record StaticResponseHandler(int statusCode, Map<String, String> headers) implements RouteHandler {

    public StaticResponseHandler {
        headers = Map.copyOf(headers);
    }

    public static StaticResponseHandler forbidden() {
        return new StaticResponseHandler(403, Map.of());
    }
}
