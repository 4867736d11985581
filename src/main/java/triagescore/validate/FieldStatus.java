package triagescore.validate;

/**
 * Validation outcome for one vital field.
 */
public enum FieldStatus {
    OK,
    CLAMPED,
    INVALID,
    MISSING
}
