package com.costsheet.core.model;

import java.util.List;

/**
 * Wall cladding geometry of an item.
 *
 * @param width cladding width in millimetres, as entered
 * @param height cladding height in millimetres, as entered
 * @param positions walls covered, e.g. {@code rear}, {@code left}
 */
public record WallCladding(
    String width,
    String height,
    List<String> positions
) {
    public WallCladding {
        positions = positions == null ? List.of() : List.copyOf(positions);
    }
}
