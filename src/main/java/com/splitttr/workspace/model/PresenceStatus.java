package com.splitttr.workspace.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum PresenceStatus {
    @JsonProperty("online") ONLINE,
    @JsonProperty("away") AWAY,
    @JsonProperty("editing") EDITING,
    @JsonProperty("idle") IDLE
}
