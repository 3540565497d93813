package com.splitttr.workspace.store;

public record SessionStatusUpdate(boolean isActive) {}
