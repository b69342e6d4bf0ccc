package com.costsheet.core.model;

import com.costsheet.core.util.Revisions;

import java.util.List;
import java.util.Objects;

/**
 * Root of the project tree: metadata plus ordered levels.
 *
 * <p>The tree is immutable. Edits produce copies via the {@code with...} methods.
 *
 * @param info project metadata
 * @param levels ordered levels
 */
public record Project(
    ProjectInfo info,
    List<Level> levels
) {
    public Project {
        Objects.requireNonNull(info, "info must not be null");
        levels = levels == null ? List.of() : List.copyOf(levels);
    }

    /**
     * Copy of this project with the revision letter advanced one step
     * ({@code ""} to {@code A}, {@code Z} to {@code AA}).
     *
     * @return revised project
     */
    public Project withNextRevision() {
        return new Project(info.withRevision(Revisions.next(info.revision())), levels);
    }

    public Project withLevels(List<Level> newLevels) {
        return new Project(info, newLevels);
    }

    /**
     * All areas of the project in level order.
     *
     * @return flattened areas
     */
    public List<Area> allAreas() {
        return levels.stream().flatMap(level -> level.areas().stream()).toList();
    }

    public List<Item> allItems() {
        return allAreas().stream().flatMap(area -> area.items().stream()).toList();
    }
}
