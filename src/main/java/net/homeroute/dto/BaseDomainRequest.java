package net.homeroute.dto;

public record BaseDomainRequest(String baseDomain) {
}
