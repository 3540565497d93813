package com.splitttr.workspace.presence;

import jakarta.enterprise.context.ApplicationScoped;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Hands out cursor colors. A user keeps the same color for the lifetime of
 * the process; once the palette is exhausted colors repeat.
 */
@ApplicationScoped
public class ColorAssigner {

    static final List<String> PALETTE = List.of(
        "#FF6B6B", "#4ECDC4", "#45B7D1", "#96CEB4", "#FFEAA7",
        "#DDA0DD", "#98D8C8", "#F7DC6F", "#BB8FCE", "#85C1E9"
    );

    private final ConcurrentHashMap<String, String> assigned = new ConcurrentHashMap<>();
    private final AtomicInteger next = new AtomicInteger();

    public String colorFor(String userId) {
        return assigned.computeIfAbsent(userId,
            id -> PALETTE.get(Math.floorMod(next.getAndIncrement(), PALETTE.size())));
    }
}
