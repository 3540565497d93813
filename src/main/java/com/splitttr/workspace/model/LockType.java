package com.splitttr.workspace.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Requested lock flavour. {@code SHARED} is accepted on the wire but conflicts
 * exactly like {@code EXCLUSIVE}.
 */
public enum LockType {
    @JsonProperty("exclusive") EXCLUSIVE,
    @JsonProperty("shared") SHARED
}
