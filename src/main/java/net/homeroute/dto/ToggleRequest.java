package net.homeroute.dto;

/**
 * Body of the toggle endpoints; a missing flag counts as {@code false}.
 */
public record ToggleRequest(Boolean enabled) {
}
