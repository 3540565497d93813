package com.splitttr.workspace.ops;

import com.splitttr.workspace.model.EditOperation;
import com.splitttr.workspace.model.Position;

import java.util.Comparator;
import java.util.List;

/**
 * Single-line position transform against earlier edits from other connections.
 *
 * <p>Only same-line shifts are applied: an insert at or before the target
 * column pushes it right by the inserted length, a delete pulls it left by the
 * deleted length (never below column 0). Multi-line effects are not modelled
 * and replaces never shift. Ordering comes from server timestamps alone; the
 * client's vector clock plays no part.
 */
public final class PositionTransformer {

    static final Comparator<EditOperation> BY_TIMESTAMP = Comparator.comparing(EditOperation::timestamp);

    private PositionTransformer() {}

    /** Pure function of its arguments; the buffer is not modified. */
    public static Position transform(EditOperation incoming, List<EditOperation> buffer) {
        Position position = incoming.position();
        for (EditOperation earlier : precedingConcurrent(incoming, buffer)) {
            position = shift(position, earlier);
        }
        return position;
    }

    /**
     * Operations on the same file from a different connection whose timestamp is
     * not after the incoming one, oldest first. Equal timestamps keep buffer order.
     */
    public static List<EditOperation> precedingConcurrent(EditOperation incoming, List<EditOperation> buffer) {
        return buffer.stream()
            .filter(op -> op.fileName().equals(incoming.fileName()))
            .filter(op -> !op.id().equals(incoming.id()))
            .filter(op -> !op.connectionId().equals(incoming.connectionId()))
            .filter(op -> !op.timestamp().isAfter(incoming.timestamp()))
            .sorted(BY_TIMESTAMP)
            .toList();
    }

    static Position shift(Position target, EditOperation earlier) {
        Position at = earlier.position();
        if (at.line() != target.line() || at.column() > target.column()) {
            return target;
        }
        return switch (earlier.type()) {
            case INSERT -> target.withColumn(target.column() + earlier.insertedLength());
            case DELETE -> target.withColumn(Math.max(0, target.column() - earlier.deletedLength()));
            case REPLACE -> target;
        };
    }
}
