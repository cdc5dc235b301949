package com.contextbus.context;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One change recorded against a snapshot version, with provenance:
 * who applied it and why.
 */
public record ContextMutation(
    @JsonProperty("kind") MutationKind kind,
    @JsonProperty("key") String key,
    @JsonProperty("actor") String actor,
    @JsonProperty("detail") String detail
) {}
