package com.project.hatchmark.core;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

public record RegisterRequest(
        @JsonProperty("hash") @JsonAlias("imageHash") String hash,
        @JsonProperty("title") String title,
        @JsonProperty("description") String description,
        @JsonProperty("sender") String sender
) {
}
