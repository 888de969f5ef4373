package com.project.hatchmark.http;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

record VerifyRequest(@JsonProperty("hash") @JsonAlias("imageHash") String hash) {
}
