package com.costsheet.core.document;

import com.costsheet.core.pricing.SpecReading;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Presentation normalization applied to every value placed in a document.
 */
public class DisplayValues {

    public static final String BLANK = "-";
    public static final String TO_BE_DETERMINED = "TBD";

    private static final Pattern LEADING_NUMBER = Pattern.compile("^\\s*(-?\\d[\\d,]*(?:\\.\\d+)?)");
    private static final DateTimeFormatter DISPLAY_DATE = DateTimeFormatter.ofPattern("d MMMM yyyy", Locale.UK);
    private static final DateTimeFormatter QUOTE_MONTH = DateTimeFormatter.ofPattern("MM", Locale.UK);
    private static final DateTimeFormatter QUOTE_YEAR = DateTimeFormatter.ofPattern("yy", Locale.UK);

    private final String currencySymbol;

    public DisplayValues(String currencySymbol) {
        this.currencySymbol = currencySymbol == null ? "" : currencySymbol;
    }

    /**
     * Blank or missing text becomes {@value #BLANK}.
     */
    public String text(String raw) {
        return raw == null || raw.isBlank() ? BLANK : raw.trim();
    }

    /**
     * Maps a lighting selection to its document wording.
     *
     * @param raw lighting selection as entered
     * @return {@code LED STRIP}, {@code LED SPOTS} or {@value #BLANK}
     */
    public String lighting(String raw) {
        if (raw == null || raw.isBlank()) {
            return BLANK;
        }
        String upper = raw.toUpperCase(Locale.ROOT);
        if (upper.contains("LED STRIP")) {
            return "LED STRIP";
        }
        if (upper.contains("SPOT")) {
            return "LED SPOTS";
        }
        return BLANK;
    }

    /**
     * Strips a unit suffix and grouping commas, so {@code "1,500 Pa"} becomes {@code "1500"}.
     */
    public String stripUnits(String raw) {
        if (raw == null || raw.isBlank()) {
            return BLANK;
        }
        Matcher matcher = LEADING_NUMBER.matcher(raw);
        return matcher.find() ? number(matcher) : raw.trim();
    }

    /**
     * Volume rounded to one decimal place for display.
     */
    public String volume(String raw) {
        if (raw == null || raw.isBlank()) {
            return BLANK;
        }
        Matcher matcher = LEADING_NUMBER.matcher(raw);
        if (!matcher.find()) {
            return raw.trim();
        }
        return new BigDecimal(number(matcher)).setScale(1, RoundingMode.HALF_UP).toPlainString();
    }

    private static String number(Matcher matcher) {
        return matcher.group(1).replace(",", "");
    }

    /**
     * Formats a spec reading; not-applicable and blank readings become {@value #BLANK}.
     */
    public String reading(SpecReading reading, UnaryOperator<String> format) {
        if (!reading.applicable() || reading.isBlank()) {
            return BLANK;
        }
        return format.apply(reading.raw());
    }

    /**
     * Quantity for display; an unspecified or non-positive quantity becomes {@value #TO_BE_DETERMINED}.
     */
    public String quantity(Integer quantity) {
        return quantity == null || quantity <= 0 ? TO_BE_DETERMINED : String.valueOf(quantity);
    }

    public String money(BigDecimal amount) {
        DecimalFormat format = new DecimalFormat("#,##0.00", DecimalFormatSymbols.getInstance(Locale.UK));
        format.setRoundingMode(RoundingMode.HALF_UP);
        BigDecimal value = amount == null ? BigDecimal.ZERO : amount;
        String formatted = format.format(value.abs());
        return (value.signum() < 0 ? "-" : "") + currencySymbol + formatted;
    }

    public String date(LocalDate date) {
        return date == null ? BLANK : DISPLAY_DATE.format(date);
    }

    /**
     * Quote reference {@code <number>/<MM>/<YY>} from the project date.
     */
    public String quoteReference(String projectNumber, LocalDate date) {
        String number = text(projectNumber);
        if (date == null) {
            return number;
        }
        return number + "/" + QUOTE_MONTH.format(date) + "/" + QUOTE_YEAR.format(date);
    }

    public String dearLine(String customer) {
        return customer == null || customer.isBlank() ? "Sir/Madam," : customer.trim() + ",";
    }

    public String subjectLine(String projectName, String location) {
        boolean hasName = projectName != null && !projectName.isBlank();
        boolean hasLocation = location != null && !location.isBlank();
        if (hasName && hasLocation) {
            return projectName.trim() + ", " + location.trim();
        }
        if (hasName) {
            return projectName.trim();
        }
        return hasLocation ? location.trim() : BLANK;
    }

    /**
     * Wall cladding wording, e.g. {@code "Cladding to rear and left walls"}.
     */
    public String claddingDescription(List<String> positions) {
        List<String> walls = positions == null ? List.of() : positions.stream()
            .filter(p -> p != null && !p.isBlank()).map(String::trim).toList();
        if (walls.isEmpty()) {
            return "Cladding to walls";
        }
        if (walls.size() == 1) {
            return "Cladding to " + walls.get(0) + " walls";
        }
        String head = String.join(", ", walls.subList(0, walls.size() - 1));
        return "Cladding to " + head + " and " + walls.get(walls.size() - 1) + " walls";
    }
}
