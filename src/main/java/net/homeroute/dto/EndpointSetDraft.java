package net.homeroute.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Endpoints of one environment in an application request.
 *
 * @param frontend frontend target
 * @param apis API targets; {@code null} keeps the stored list on update
 * @param api single API target sent by older dashboard builds, used when {@code apis} is absent
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EndpointSetDraft(
    EndpointDraft frontend,
    List<ApiEndpointDraft> apis,
    EndpointDraft api
) {
}
