package com.splitttr.workspace.store;

import com.splitttr.workspace.model.CursorState;
import com.splitttr.workspace.model.Position;

public record CursorRecord(
    String fileName,
    int line,
    int column,
    Position selectionStart,
    Position selectionEnd,
    String cursorColor,
    boolean isVisible
) {
    public static CursorRecord of(CursorState cursor) {
        return new CursorRecord(cursor.fileName(), cursor.line(), cursor.column(),
            cursor.selectionStart(), cursor.selectionEnd(), cursor.cursorColor(), cursor.isVisible());
    }
}
