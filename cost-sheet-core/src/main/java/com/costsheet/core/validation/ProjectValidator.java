package com.costsheet.core.validation;

import com.costsheet.core.exception.ProjectValidationException;
import com.costsheet.core.exception.ValidationIssue;
import com.costsheet.core.model.Area;
import com.costsheet.core.model.CostPool;
import com.costsheet.core.model.EquipmentKind;
import com.costsheet.core.model.Item;
import com.costsheet.core.model.ItemOption;
import com.costsheet.core.model.Level;
import com.costsheet.core.model.Project;
import com.costsheet.core.model.SharedCosts;
import com.costsheet.core.model.SheetScope;
import com.costsheet.core.workbook.SheetLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Checks a project tree before anything is priced or written.
 *
 * <p>Rules:
 * <ul>
 *   <li>{@code missing-project-number}</li>
 *   <li>{@code blank-level-name}, {@code blank-area-name}</li>
 *   <li>{@code missing-reference}, {@code duplicate-reference} - references are compared
 *       ignoring case and surrounding whitespace</li>
 *   <li>{@code negative-price}, {@code negative-quantity}, {@code negative-shared-cost}</li>
 *   <li>{@code too-many-items} - an area holds at most as many items as a sheet has blocks</li>
 *   <li>{@code invalid-item-option}, {@code invalid-area-option}</li>
 *   <li>{@code unsupported-shared-cost} - shared costs for a kind that has no sheet, or for a
 *       kind with one sheet per item when no item of the area or level carries it</li>
 * </ul>
 */
public class ProjectValidator {

    private static final Logger log = LoggerFactory.getLogger(ProjectValidator.class);

    /**
     * Validates a project.
     *
     * @param project project to check
     * @return issues in tree order, empty when valid
     */
    public List<ValidationIssue> validate(Project project) {
        List<ValidationIssue> issues = new ArrayList<>();
        if (isBlank(project.info().number())) {
            issues.add(new ValidationIssue("project.number", "missing-project-number",
                "Project number is required"));
        }

        Map<String, String> seenReferences = new HashMap<>();
        for (int l = 0; l < project.levels().size(); l++) {
            Level level = project.levels().get(l);
            String levelPath = "levels[" + l + "]";
            if (isBlank(level.name())) {
                issues.add(new ValidationIssue(levelPath + ".name", "blank-level-name", "Level name is blank"));
            }
            List<Item> levelItems = level.areas().stream().flatMap(area -> area.items().stream()).toList();
            checkSharedCosts(levelPath, level.sharedCosts(), levelItems, issues);

            for (int a = 0; a < level.areas().size(); a++) {
                Area area = level.areas().get(a);
                String areaPath = levelPath + ".areas[" + a + "]";
                checkArea(areaPath, area, issues);
                for (int i = 0; i < area.items().size(); i++) {
                    checkItem(areaPath + ".items[" + i + "]", area.items().get(i), seenReferences, issues);
                }
            }
        }

        if (issues.isEmpty()) {
            log.debug("Project {} is valid", project.info().number());
        } else {
            log.warn("Project {} has {} validation issues", project.info().number(), issues.size());
        }
        return List.copyOf(issues);
    }

    /**
     * Validates a project and fails if any issue is found.
     *
     * @param project project to check
     * @throws ProjectValidationException if any issue is found
     */
    public void requireValid(Project project) {
        List<ValidationIssue> issues = validate(project);
        if (!issues.isEmpty()) {
            throw new ProjectValidationException(issues);
        }
    }

    private void checkArea(String areaPath, Area area, List<ValidationIssue> issues) {
        if (isBlank(area.name())) {
            issues.add(new ValidationIssue(areaPath + ".name", "blank-area-name", "Area name is blank"));
        }
        if (area.items().size() > SheetLayout.MAX_ITEM_BLOCKS) {
            issues.add(new ValidationIssue(areaPath + ".items", "too-many-items",
                "Area has " + area.items().size() + " items, a sheet holds at most " + SheetLayout.MAX_ITEM_BLOCKS));
        }
        for (EquipmentKind kind : area.options()) {
            if (!kind.isAreaOption()) {
                issues.add(new ValidationIssue(areaPath + ".options", "invalid-area-option",
                    kind.label() + " cannot be switched on for a whole area"));
            }
        }
        checkSharedCosts(areaPath, area.sharedCosts(), area.items(), issues);
    }

    private void checkItem(String itemPath, Item item, Map<String, String> seenReferences,
                           List<ValidationIssue> issues) {
        if (isBlank(item.reference())) {
            issues.add(new ValidationIssue(itemPath + ".reference", "missing-reference", "Item reference is blank"));
        } else {
            String key = item.reference().trim().toUpperCase(Locale.ROOT);
            String previous = seenReferences.putIfAbsent(key, itemPath);
            if (previous != null) {
                issues.add(new ValidationIssue(itemPath + ".reference", "duplicate-reference",
                    "Reference " + item.reference() + " is already used at " + previous));
            }
        }
        if (isNegative(item.basePrice())) {
            issues.add(new ValidationIssue(itemPath + ".basePrice", "negative-price", "Base price is negative"));
        }
        for (Map.Entry<EquipmentKind, ItemOption> entry : item.options().entrySet()) {
            EquipmentKind kind = entry.getKey();
            String optionPath = itemPath + ".options." + kind.name();
            if (!kind.isItemOption()) {
                issues.add(new ValidationIssue(optionPath, "invalid-item-option",
                    kind.label() + " cannot be an item option"));
            }
            ItemOption option = entry.getValue();
            if (isNegative(option.price())) {
                issues.add(new ValidationIssue(optionPath + ".price", "negative-price",
                    kind.label() + " price is negative"));
            }
            if (option.quantity() != null && option.quantity() < 0) {
                issues.add(new ValidationIssue(optionPath + ".quantity", "negative-quantity",
                    kind.label() + " quantity is negative"));
            }
        }
    }

    private void checkSharedCosts(String path, Map<EquipmentKind, SharedCosts> sharedCosts,
                                  Collection<Item> items, List<ValidationIssue> issues) {
        for (Map.Entry<EquipmentKind, SharedCosts> entry : sharedCosts.entrySet()) {
            EquipmentKind kind = entry.getKey();
            String poolPath = path + ".sharedCosts." + kind.name();
            if (!kind.hasSheet() && entry.getValue().hasAny()) {
                issues.add(new ValidationIssue(poolPath, "unsupported-shared-cost",
                    kind.label() + " has no sheet to carry shared costs"));
            } else if (kind.sheetScope() == SheetScope.ITEM && entry.getValue().hasAny()
                && items.stream().noneMatch(item -> item.hasOption(kind))) {
                issues.add(new ValidationIssue(poolPath, "unsupported-shared-cost",
                    kind.label() + " shared costs need an item carrying " + kind.label() + " to sit on its sheet"));
            }
            for (CostPool pool : CostPool.values()) {
                if (isNegative(entry.getValue().amount(pool))) {
                    issues.add(new ValidationIssue(poolPath, "negative-shared-cost",
                        pool.label() + " for " + kind.label() + " is negative"));
                }
            }
        }
    }

    private static boolean isNegative(BigDecimal value) {
        return value != null && value.signum() < 0;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
