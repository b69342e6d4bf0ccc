package com.costsheet.core;

import com.costsheet.core.model.Area;
import com.costsheet.core.model.EquipmentKind;
import com.costsheet.core.model.Item;
import com.costsheet.core.model.ItemOption;
import com.costsheet.core.model.ItemSpec;
import com.costsheet.core.model.Level;
import com.costsheet.core.model.Project;
import com.costsheet.core.model.ProjectInfo;
import com.costsheet.core.model.SharedCosts;
import com.costsheet.core.model.WallCladding;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Project fixtures shared by the core tests.
 */
public final class TestProjects {

    public static final String LEVEL = "Ground Floor";
    public static final String AREA = "Main Kitchen";

    private TestProjects() {
    }

    public static ProjectInfo info() {
        return new ProjectInfo("Hotel Refit", "1234", "Jane Smith", "Acme Hotels Ltd", "1 High Street, Leeds",
            "Leeds", "Site entrance B", "Yazan Hunjul / Joe Salloum", "Sam Sales", LocalDate.of(2025, 1, 15), "");
    }

    public static ItemSpec spec() {
        return new ItemSpec("2500", "1200", "555", "2", "LED STRIP L12", "1.25", "150 Pa", "0.95", "45 Pa", "120 kg", null);
    }

    public static Item canopy(String reference, String model, String basePrice) {
        return new Item(reference, model, "Wall", new BigDecimal(basePrice), spec(), Map.of());
    }

    public static Item withOption(Item item, EquipmentKind kind, String price, Integer quantity) {
        return item.withOption(kind, new ItemOption(new BigDecimal(price), null, quantity));
    }

    public static SharedCosts delivery(String amount) {
        return new SharedCosts(new BigDecimal(amount), null);
    }

    public static Project project(Area... areas) {
        return new Project(info(), List.of(new Level(LEVEL, List.of(areas), Map.of())));
    }

    /**
     * Two fire suppression items priced 1690 and 1200 with an area delivery pool of 800.
     */
    public static Project twoFireSuppressionItems() {
        Item first = withOption(canopy("C1", "KVF", "5000"), EquipmentKind.FIRE_SUPPRESSION, "1690", 2);
        Item second = withOption(canopy("C2", "KVI", "4000"), EquipmentKind.FIRE_SUPPRESSION, "1200", null);
        return project(new Area(AREA, Set.of(), List.of(first, second),
            Map.of(EquipmentKind.FIRE_SUPPRESSION, delivery("800"))));
    }

    /**
     * A single fire suppression item priced 500 with an area delivery pool of 800.
     */
    public static Project singleFireSuppressionItem() {
        Item only = withOption(canopy("C1", "KVF", "5000"), EquipmentKind.FIRE_SUPPRESSION, "500", 1);
        return project(new Area(AREA, Set.of(), List.of(only),
            Map.of(EquipmentKind.FIRE_SUPPRESSION, delivery("800"))));
    }

    /**
     * A project touching every kind: cladding, fire suppression, UV-C, an SDU, and an area RecoAir option.
     */
    public static Project everyKind() {
        Item clad = canopy("C1", "UVF", "6000")
            .withSpec(new ItemSpec("3000", "1500", "555", "3", "LED SPOTS", "1.46", "160 Pa", "1.1", "50 Pa", "150",
                new WallCladding("3000", "1200", List.of("rear", "left"))));
        clad = withOption(clad, EquipmentKind.WALL_CLADDING, "750", null);
        clad = withOption(clad, EquipmentKind.FIRE_SUPPRESSION, "1690", 2);
        clad = withOption(clad, EquipmentKind.UV_C, "2400", 1);
        Item island = withOption(canopy("C2", "CMWI", "8000"), EquipmentKind.SDU, "3200", 1);
        Area kitchen = new Area(AREA, Set.of(EquipmentKind.RECOAIR), List.of(clad, island), Map.of(
            EquipmentKind.CANOPY, new SharedCosts(new BigDecimal("1500"), new BigDecimal("300")),
            EquipmentKind.FIRE_SUPPRESSION, delivery("800")));
        return project(kitchen);
    }
}
