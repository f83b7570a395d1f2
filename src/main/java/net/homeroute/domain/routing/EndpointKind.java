package net.homeroute.domain.routing;

/**
 * Which side of an application an endpoint serves. Frontends and APIs follow
 * different hostname rules, and APIs carry an optional disambiguating slug.
 */
public sealed interface EndpointKind permits EndpointKind.Frontend, EndpointKind.Api {

    EndpointKind FRONTEND = new Frontend();

    static EndpointKind api(String slug) {
        return new Api(slug == null ? "" : slug);
    }

    /**
     * Segment used inside compiled route ids: {@code frontend}, {@code api} or {@code api-<slug>}.
     */
    String routeIdSegment();

    record Frontend() implements EndpointKind {
        @Override
        public String routeIdSegment() {
            return "frontend";
        }
    }

    record Api(String slug) implements EndpointKind {

        public boolean hasSlug() {
            return !slug.isEmpty();
        }

        @Override
        public String routeIdSegment() {
            return hasSlug() ? "api-" + slug : "api";
        }
    }
}
