package com.returnlint.json;

import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Pluggable JSON binding for function trees, policy configuration and lint results.
 *
 * <p>Bindings register themselves under {@code META-INF/services}; putting returnlint-jackson
 * on the classpath is enough for {@link #getProvider()} to find it.</p>
 *
 * <pre>{@code
 * AstJsonProvider provider = AstJsonProvider.getProvider();
 * Node tree = provider.getDeserializer().deserializeTree(json);
 * String out = provider.getSerializer().serializeDiagnostics(new ReturnLinter().lint(tree));
 * }</pre>
 */
public interface AstJsonProvider {

    AstJsonSerializer getSerializer();

    AstJsonDeserializer getDeserializer();

    /** Short binding name, matched case-insensitively by {@link #getProvider(String)}. */
    String getName();

    /**
     * @throws IllegalStateException if no binding is registered
     */
    static AstJsonProvider getProvider() {
        return ServiceLoader.load(AstJsonProvider.class).findFirst()
            .orElseThrow(() -> new IllegalStateException(
                "No AstJsonProvider registered; add returnlint-jackson to the classpath"));
    }

    /**
     * @throws IllegalStateException if no registered binding carries the given name
     */
    static AstJsonProvider getProvider(String name) {
        Optional<AstJsonProvider> match = ServiceLoader.load(AstJsonProvider.class).stream()
            .map(ServiceLoader.Provider::get)
            .filter(provider -> provider.getName().equalsIgnoreCase(name))
            .findFirst();
        return match.orElseThrow(() -> new IllegalStateException("No AstJsonProvider named '" + name + "'"));
    }

    static boolean isProviderAvailable() {
        return ServiceLoader.load(AstJsonProvider.class).findFirst().isPresent();
    }
}
