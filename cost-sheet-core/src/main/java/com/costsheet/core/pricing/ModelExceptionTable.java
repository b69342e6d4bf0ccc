package com.costsheet.core.pricing;

import com.costsheet.core.model.Item;
import com.costsheet.core.model.SpecField;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Model-specific field suppression rules.
 *
 * <p>Every rule whose prefix matches the model applies; the suppressed sets are unioned.
 * A model with no matching rule keeps all of its fields.
 *
 * <p><b>Example YAML</b> ({@code model-exceptions.yaml} on the classpath):
 * <pre>{@code
 * rules:
 *   - prefix: CMW
 *     suppress: [EXTRACT_STATIC]
 *   - prefix: KVI
 *     suppress: [SUPPLY_VOLUME, SUPPLY_STATIC]
 * }</pre>
 */
public final class ModelExceptionTable {

    private static final Logger log = LoggerFactory.getLogger(ModelExceptionTable.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    public static final String RESOURCE = "model-exceptions.yaml";

    private final List<ModelExceptionRule> rules;

    public ModelExceptionTable(List<ModelExceptionRule> rules) {
        this.rules = rules == null ? List.of() : List.copyOf(rules);
    }

    /**
     * Built-in rules, used when the classpath resource is missing or unreadable.
     *
     * @return default table
     */
    public static ModelExceptionTable defaults() {
        Set<SpecField> noSupply = EnumSet.of(SpecField.SUPPLY_VOLUME, SpecField.SUPPLY_STATIC);
        return new ModelExceptionTable(List.of(
            new ModelExceptionRule("CMW", EnumSet.of(SpecField.EXTRACT_STATIC)),
            new ModelExceptionRule("KVI", noSupply),
            new ModelExceptionRule("KVE", noSupply),
            new ModelExceptionRule("KVT", noSupply),
            new ModelExceptionRule("UVI", noSupply),
            new ModelExceptionRule("UVE", noSupply),
            new ModelExceptionRule("CMWI", noSupply)
        ));
    }

    /**
     * Loads {@value #RESOURCE} from the classpath.
     *
     * @return loaded table, or {@link #defaults()} if the resource is missing or invalid
     */
    public static ModelExceptionTable load() {
        try (InputStream in = ModelExceptionTable.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                log.warn("{} not found on classpath. Using built-in model exceptions.", RESOURCE);
                return defaults();
            }
            RuleFile file = YAML_MAPPER.readValue(in, RuleFile.class);
            log.debug("Loaded {} model exception rules from {}", file.rules().size(), RESOURCE);
            return new ModelExceptionTable(file.rules());
        } catch (IOException e) {
            log.error("Failed to parse {}. Using built-in model exceptions. Error: {}", RESOURCE, e.getMessage());
            return defaults();
        }
    }

    public List<ModelExceptionRule> rules() {
        return rules;
    }

    /**
     * Fields suppressed for the given model.
     *
     * @param model model identifier, may be null
     * @return union of the suppressed fields of every matching rule
     */
    public Set<SpecField> suppressedFields(String model) {
        Set<SpecField> suppressed = EnumSet.noneOf(SpecField.class);
        for (ModelExceptionRule rule : rules) {
            if (rule.matches(model)) {
                suppressed.addAll(rule.suppress());
            }
        }
        return Collections.unmodifiableSet(suppressed);
    }

    /**
     * Reads one presentation field of an item through the rules.
     *
     * @param item item to read
     * @param field field to read
     * @return the stored value, or {@link SpecReading#notApplicable()} when suppressed
     */
    public SpecReading read(Item item, SpecField field) {
        if (suppressedFields(item.model()).contains(field)) {
            return SpecReading.notApplicable();
        }
        return SpecReading.of(item.spec().value(field));
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RuleFile(@JsonProperty("rules") List<ModelExceptionRule> rules) {
        RuleFile {
            rules = rules == null ? List.of() : rules;
        }
    }
}
