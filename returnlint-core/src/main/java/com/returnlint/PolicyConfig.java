package com.returnlint;

import java.util.List;

/**
 * Raw configuration values as read from a config file or command line.
 * Null means "not set"; {@link #toPolicy()} fills in the defaults.
 */
public record PolicyConfig(
    String returnStyle,
    Boolean allowImplicitElse,
    List<String> returnFunctions,
    List<String> except
) {
    public static final PolicyConfig EMPTY = new PolicyConfig(null, null, null, null);

    /**
     * Values from {@code overrides} win where they are set.
     */
    public PolicyConfig overriddenBy(PolicyConfig overrides) {
        return new PolicyConfig(
            overrides.returnStyle != null ? overrides.returnStyle : returnStyle,
            overrides.allowImplicitElse != null ? overrides.allowImplicitElse : allowImplicitElse,
            overrides.returnFunctions != null ? overrides.returnFunctions : returnFunctions,
            overrides.except != null ? overrides.except : except
        );
    }

    /**
     * @throws InvalidPolicyException if {@code returnStyle} is set to an unknown style
     */
    public Policy toPolicy() {
        Policy.Builder builder = Policy.builder();
        if (returnStyle != null) {
            builder.style(returnStyle);
        }
        if (allowImplicitElse != null) {
            builder.allowImplicitElse(allowImplicitElse);
        }
        return builder
            .returnFunctions(returnFunctions)
            .except(except)
            .build();
    }
}
