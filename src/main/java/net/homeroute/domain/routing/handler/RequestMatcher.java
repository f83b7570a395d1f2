package net.homeroute.domain.routing.handler;

/**
 * Predicate guarding a {@link SubrouteBranch}.
 */
public sealed interface RequestMatcher permits RemoteIpMatcher, HeaderMatcher {
}
