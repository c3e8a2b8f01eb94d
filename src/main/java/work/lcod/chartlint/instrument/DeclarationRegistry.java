package work.lcod.chartlint.instrument;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Token to declaration mapping built during instrumentation and frozen before rendering.
 */
public final class DeclarationRegistry {
    private final Map<String, Declaration> entries = new LinkedHashMap<>();
    private boolean frozen;

    public synchronized void register(String token, Declaration declaration) {
        if (frozen) {
            throw new IllegalStateException("Registry is frozen; cannot register " + declaration.location());
        }
        if (entries.putIfAbsent(token, declaration) != null) {
            throw new IllegalStateException("Duplicate marker token: " + token);
        }
    }

    public synchronized DeclarationRegistry freeze() {
        frozen = true;
        return this;
    }

    public synchronized boolean isFrozen() {
        return frozen;
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized Map<String, Declaration> entries() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }
}
