package com.splitttr.workspace.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum OperationType {
    @JsonProperty("insert") INSERT,
    @JsonProperty("delete") DELETE,
    @JsonProperty("replace") REPLACE
}
