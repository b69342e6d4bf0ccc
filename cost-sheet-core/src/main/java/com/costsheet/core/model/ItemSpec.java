package com.costsheet.core.model;

/**
 * Presentation-only specification fields of an item, kept as entered.
 *
 * <p>Values are raw strings because users type units and free text into them
 * ({@code "150 Pa"}, {@code "1.2"}). Normalization happens when a document is built.
 *
 * @param length length in millimetres
 * @param width width in millimetres
 * @param height height in millimetres
 * @param sections number of sections
 * @param lightingType lighting selection
 * @param extractVolume extract volume in m3/s
 * @param extractStatic extract static pressure
 * @param supplyVolume supply (MUA) volume in m3/s
 * @param supplyStatic supply static pressure
 * @param weight unit weight
 * @param wallCladding wall cladding geometry, null when not clad
 */
public record ItemSpec(
    String length,
    String width,
    String height,
    String sections,
    String lightingType,
    String extractVolume,
    String extractStatic,
    String supplyVolume,
    String supplyStatic,
    String weight,
    WallCladding wallCladding
) {
    public static final ItemSpec EMPTY = new ItemSpec(null, null, null, null, null, null, null, null, null, null, null);

    /**
     * Raw value of one presentation field.
     *
     * @param field field to read
     * @return stored value, possibly null
     */
    public String value(SpecField field) {
        return switch (field) {
            case LENGTH -> length;
            case WIDTH -> width;
            case HEIGHT -> height;
            case SECTIONS -> sections;
            case LIGHTING -> lightingType;
            case EXTRACT_VOLUME -> extractVolume;
            case EXTRACT_STATIC -> extractStatic;
            case SUPPLY_VOLUME -> supplyVolume;
            case SUPPLY_STATIC -> supplyStatic;
            case WEIGHT -> weight;
        };
    }
}
