package io.parley.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RemoteToolsConfig(
    boolean enabled,
    @JsonAlias({"base_url"}) String baseUrl
) {

    public static RemoteToolsConfig defaults() {
        return new RemoteToolsConfig(false, "http://127.0.0.1:3333");
    }
}
