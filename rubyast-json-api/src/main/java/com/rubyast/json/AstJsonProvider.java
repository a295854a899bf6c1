package com.rubyast.json;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

/**
 * A JSON backend for trees, found through {@link ServiceLoader}. Putting
 * rubyast-jackson on the classpath registers the "Jackson" backend.
 *
 * <pre>{@code
 * AstJsonProvider json = AstJsonProvider.getProvider();
 * String text = json.getSerializer().serialize(classDef);
 * ClassDef back = json.getDeserializer().deserialize(text, ClassDef.class);
 * }</pre>
 */
public interface AstJsonProvider {

    AstJsonSerializer getSerializer();

    AstJsonDeserializer getDeserializer();

    /**
     * Short backend name, e.g. "Jackson".
     */
    String getName();

    /**
     * Returns the first backend on the classpath.
     *
     * @throws IllegalStateException if there is none
     */
    static AstJsonProvider getProvider() {
        for (AstJsonProvider provider : ServiceLoader.load(AstJsonProvider.class)) {
            return provider;
        }
        throw new IllegalStateException("No tree JSON backend on the classpath; add rubyast-jackson");
    }

    /**
     * Returns the backend called {@code name}, ignoring case.
     *
     * @throws IllegalStateException if no backend has that name
     */
    static AstJsonProvider getProvider(String name) {
        for (AstJsonProvider provider : ServiceLoader.load(AstJsonProvider.class)) {
            if (provider.getName().equalsIgnoreCase(name)) {
                return provider;
            }
        }
        throw new IllegalStateException("No tree JSON backend named '" + name + "'; found " + availableProviders());
    }

    static List<String> availableProviders() {
        List<String> names = new ArrayList<>();
        for (AstJsonProvider provider : ServiceLoader.load(AstJsonProvider.class)) {
            names.add(provider.getName());
        }
        return names;
    }
}
