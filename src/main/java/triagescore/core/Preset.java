package triagescore.core;

import java.util.Locale;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Named, pre-validated parameter sets.
 */
public enum Preset {
    DEFAULT(TriageParams::defaults),
    STRICT(TriageParams::strict),
    LENIENT(TriageParams::lenient),
    RESEARCH(TriageParams::research);

    private final Supplier<TriageParams> params;

    Preset(Supplier<TriageParams> params) {
        this.params = params;
    }

    public TriageParams params() {
        return params.get();
    }

    /**
     * Look up a preset by name, case-insensitive.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static Preset fromName(String name) {
        Objects.requireNonNull(name, "name cannot be null");
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown preset: " + name, e);
        }
    }
}
