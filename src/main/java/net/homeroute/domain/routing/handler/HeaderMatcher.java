package net.homeroute.domain.routing.handler;

import java.util.List;

public record HeaderMatcher(String name, List<String> values) implements RequestMatcher {

    public HeaderMatcher {
        values = List.copyOf(values);
    }

    public static HeaderMatcher websocketUpgrade() {
        return new HeaderMatcher("Upgrade", List.of("websocket"));
    }
}
