package net.homeroute.dto;

public record CloudflareRequest(Boolean enabled) {
}
