package com.splitttr.workspace.model;

public record CursorState(
    String userId,
    String fileName,
    int line,
    int column,
    Position selectionStart,
    Position selectionEnd,
    String cursorColor,
    boolean isVisible
) {}
