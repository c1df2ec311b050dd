package com.returnlint;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable return-style policy shared by every analysis in a run.
 *
 * <p>The fixed exit functions are always part of {@link #returnFunctions()} and the
 * namespace hooks are always part of {@link #except()}; configured names are added
 * on top of them.</p>
 */
public final class Policy {

    /** Calls that always count as an explicit exit. */
    public static final Set<String> BASE_RETURN_FUNCTIONS = Set.of(
        // Normal calls
        "return", "stop", "q", "quit",
        "invokeRestart", "tryInvokeRestart",
        // S3 dispatch
        "UseMethod", "NextMethod",
        // S4 dispatch
        "standardGeneric", "callNextMethod",
        // Foreign calls
        ".C", ".Call", ".External", ".Fortran"
    );

    /** Namespace and session hooks that are never checked. */
    public static final Set<String> LIFECYCLE_HOOKS = Set.of(
        ".onLoad", ".onUnload", ".onAttach", ".onDetach",
        ".Last.lib", ".First", ".Last"
    );

    private static final Policy DEFAULTS = builder().build();

    private final ReturnStyle style;
    private final boolean allowImplicitElse;
    private final Set<String> returnFunctions;
    private final Set<String> except;

    private Policy(Builder builder) {
        this.style = builder.style;
        this.allowImplicitElse = builder.allowImplicitElse;
        this.returnFunctions = union(BASE_RETURN_FUNCTIONS, builder.returnFunctions);
        this.except = union(LIFECYCLE_HOOKS, builder.except);
    }

    /**
     * Implicit style with implicit else allowed.
     */
    public static Policy defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public ReturnStyle style() {
        return style;
    }

    public boolean allowImplicitElse() {
        return allowImplicitElse;
    }

    public Set<String> returnFunctions() {
        return returnFunctions;
    }

    public Set<String> except() {
        return except;
    }

    public boolean isReturnFunction(String name) {
        return name != null && returnFunctions.contains(name);
    }

    /**
     * Whether a function bound to {@code name} is skipped by this policy.
     * The exemption list is only consulted for explicit style or when
     * implicit else is disallowed.
     */
    public boolean isExempt(String name) {
        if (name == null) {
            return false;
        }
        boolean exemptionsActive = style == ReturnStyle.EXPLICIT || !allowImplicitElse;
        return exemptionsActive && except.contains(name);
    }

    private static Set<String> union(Set<String> base, Collection<String> extra) {
        Set<String> result = new LinkedHashSet<>(base);
        result.addAll(extra);
        return Set.copyOf(result);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Policy other)) return false;
        return style == other.style
            && allowImplicitElse == other.allowImplicitElse
            && returnFunctions.equals(other.returnFunctions)
            && except.equals(other.except);
    }

    @Override
    public int hashCode() {
        return Objects.hash(style, allowImplicitElse, returnFunctions, except);
    }

    @Override
    public String toString() {
        return "Policy[style=" + style.configName() +
            ", allowImplicitElse=" + allowImplicitElse +
            ", returnFunctions=" + returnFunctions.size() +
            ", except=" + except.size() + "]";
    }

    public static final class Builder {
        private ReturnStyle style = ReturnStyle.IMPLICIT;
        private boolean allowImplicitElse = true;
        private final Set<String> returnFunctions = new LinkedHashSet<>();
        private final Set<String> except = new LinkedHashSet<>();

        private Builder() {
        }

        public Builder style(ReturnStyle style) {
            this.style = Objects.requireNonNull(style, "style");
            return this;
        }

        /**
         * Sets the style from its configuration name.
         *
         * @throws InvalidPolicyException for anything other than "implicit" or "explicit"
         */
        public Builder style(String name) {
            this.style = ReturnStyle.fromName(name);
            return this;
        }

        public Builder allowImplicitElse(boolean allowImplicitElse) {
            this.allowImplicitElse = allowImplicitElse;
            return this;
        }

        public Builder returnFunctions(Collection<String> names) {
            addNames(returnFunctions, names, "return_functions");
            return this;
        }

        public Builder except(Collection<String> names) {
            addNames(except, names, "except");
            return this;
        }

        public Policy build() {
            return new Policy(this);
        }

        private static void addNames(Set<String> target, Collection<String> names, String key) {
            if (names == null) {
                return;
            }
            for (String name : names) {
                if (name == null || name.isBlank()) {
                    throw new InvalidPolicyException(key + " must not contain blank names");
                }
                target.add(name);
            }
        }
    }
}
