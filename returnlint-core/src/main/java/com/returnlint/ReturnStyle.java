package com.returnlint;

public enum ReturnStyle {
    /** The last evaluated expression is the result; {@code return()} at the end is redundant. */
    IMPLICIT("implicit"),
    /** Every terminal position must call an exit function such as {@code return()}. */
    EXPLICIT("explicit");

    private final String configName;

    ReturnStyle(String configName) {
        this.configName = configName;
    }

    public String configName() {
        return configName;
    }

    /**
     * Parses a {@code return_style} configuration value.
     *
     * @throws InvalidPolicyException if the value is neither "implicit" nor "explicit"
     */
    public static ReturnStyle fromName(String name) {
        for (ReturnStyle style : values()) {
            if (style.configName.equals(name)) {
                return style;
            }
        }
        throw new InvalidPolicyException(
            "return_style must be one of \"implicit\" or \"explicit\", got: " +
            (name == null ? "null" : "\"" + name + "\""));
    }
}
