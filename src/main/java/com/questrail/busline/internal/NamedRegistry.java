package com.questrail.busline.internal;

import com.questrail.busline.error.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * NamedRegistry
 * -----------------------------------------------------------------------------
 * Thread-safe name → implementation table shared by the adapter and encoder
 * registries.
 *
 * <p>Lookups used while building a client go through {@link #require(String)},
 * which turns a miss into a {@link ConfigurationException} naming the
 * registered alternatives.</p>
 *
 * @param <T> capability type held by the registry
 */
public class NamedRegistry<T>
{
    private static final Logger log = LoggerFactory.getLogger(NamedRegistry.class);

    private final String kind;
    private final ConcurrentMap<String, T> entries = new ConcurrentHashMap<>();

    protected NamedRegistry(String kind)
    {
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    /**
     * Registers (or replaces) the implementation for {@code name}.
     */
    public void register(String name, T implementation)
    {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(implementation, "implementation");

        T previous = entries.put(name, implementation);
        if (previous != null) {
            log.debug("Replaced {} '{}'", kind, name);
        } else {
            log.debug("Registered {} '{}'", kind, name);
        }
    }

    public Optional<T> resolve(String name)
    {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.get(name));
    }

    /**
     * @throws ConfigurationException if nothing is registered under {@code name}
     */
    public T require(String name)
    {
        return resolve(name).orElseThrow(() -> new ConfigurationException(
                "No " + kind + " registered as '" + name + "' (known: " + names() + ")"));
    }

    public boolean isRegistered(String name)
    {
        return resolve(name).isPresent();
    }

    public Set<String> names()
    {
        return new TreeSet<>(entries.keySet());
    }
}
