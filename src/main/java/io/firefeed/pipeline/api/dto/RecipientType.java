package io.firefeed.pipeline.api.dto;

public enum RecipientType {
    CHANNEL("channel"),
    USER("user");

    private final String dbValue;

    RecipientType(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }

    public static RecipientType fromDbValue(String value) {
        for (RecipientType type : values()) {
            if (type.dbValue.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown recipient type: " + value);
    }
}
