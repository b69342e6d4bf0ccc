package com.costsheet.core.workbook;

import com.costsheet.core.exception.SheetPoolExhaustedException;
import com.costsheet.core.model.EquipmentKind;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Freelist of the slot sheets of one kind.
 *
 * <p>Slots are handed out lowest number first, so the same project always lands on the
 * same slots.
 */
public final class SheetPool {

    private final EquipmentKind kind;
    private final TreeMap<Integer, String> free = new TreeMap<>();
    private final TreeMap<Integer, String> taken = new TreeMap<>();
    private final int capacity;

    public SheetPool(EquipmentKind kind, List<String> slotNames) {
        this.kind = kind;
        for (String name : slotNames) {
            int number = SheetNaming.slotNumber(kind, name)
                .orElseThrow(() -> new IllegalArgumentException(name + " is not a " + kind.sheetPrefix() + " slot"));
            free.put(number, name);
        }
        this.capacity = free.size();
    }

    /**
     * Collects the slot sheets of a kind from a workbook.
     *
     * @param workbook template workbook
     * @param kind sheet-bearing kind
     * @return pool over the workbook's slots
     */
    public static SheetPool discover(Workbook workbook, EquipmentKind kind) {
        List<String> names = new ArrayList<>();
        for (Sheet sheet : workbook) {
            if (SheetNaming.slotNumber(kind, sheet.getSheetName()).isPresent()) {
                names.add(sheet.getSheetName());
            }
        }
        return new SheetPool(kind, names);
    }

    public EquipmentKind kind() {
        return kind;
    }

    public int capacity() {
        return capacity;
    }

    public int available() {
        return free.size();
    }

    /**
     * Fails fast when the pool cannot serve a whole request.
     *
     * @param requested number of slots needed
     * @throws SheetPoolExhaustedException if the pool holds fewer slots
     */
    public void ensureCapacity(int requested) {
        if (requested > available()) {
            throw new SheetPoolExhaustedException(kind, requested, available());
        }
    }

    /**
     * Pops the lowest-numbered free slot.
     *
     * @return slot sheet name
     * @throws SheetPoolExhaustedException if no slot is left
     */
    public String acquire() {
        Map.Entry<Integer, String> entry = free.pollFirstEntry();
        if (entry == null) {
            throw new SheetPoolExhaustedException(kind, taken.size() + 1, capacity);
        }
        taken.put(entry.getKey(), entry.getValue());
        return entry.getValue();
    }

    /**
     * Returns a slot to the pool.
     *
     * @param slotName name the slot was acquired under
     * @throws IllegalArgumentException if the slot was not acquired from this pool
     */
    public void release(String slotName) {
        Optional<Integer> number = SheetNaming.slotNumber(kind, slotName);
        if (number.isEmpty() || taken.remove(number.get()) == null) {
            throw new IllegalArgumentException(slotName + " was not acquired from the " + kind.sheetPrefix() + " pool");
        }
        free.put(number.get(), slotName);
    }

    public List<String> unused() {
        return List.copyOf(free.values());
    }
}
