package com.streambot.client.negotiate;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of the {@code gettoken} call. The server uses snake_case field names;
 * camelCase is accepted too.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
class TokenResponse {
    private Integer errcode;
    private String errmsg;

    @JsonAlias("access_token")
    private String accessToken;

    @JsonAlias("expires_in")
    private Long expiresIn;
}
