package com.streambot.client.negotiate;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of the gateway {@code connections/open} call.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
class EndpointResponse {
    private String endpoint;
    private String ticket;
}
