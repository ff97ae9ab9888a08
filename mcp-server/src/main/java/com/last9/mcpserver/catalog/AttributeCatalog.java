package com.last9.mcpserver.catalog;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Attribute names observed in a tenant's telemetry for one query window. Sorted, without
 * blanks or duplicates. Built per call and never cached.
 *
 * <p>An empty catalog means existence checks are skipped; {@link #getWarning()} says why when
 * discovery failed.
 */
public final class AttributeCatalog {

    public static final String RESOURCE_PREFIX = "resource_";

    private static final AttributeCatalog EMPTY = new AttributeCatalog(Collections.emptySet(), null);

    private final Set<String> names;
    private final String warning;

    private AttributeCatalog(Set<String> names, String warning) {
        this.names = names;
        this.warning = warning;
    }

    public static AttributeCatalog of(Collection<String> names) {
        TreeSet<String> sorted = names.stream()
                .filter(n -> n != null && !n.isBlank())
                .collect(Collectors.toCollection(TreeSet::new));
        return new AttributeCatalog(Collections.unmodifiableSet(sorted), null);
    }

    public static AttributeCatalog empty() {
        return EMPTY;
    }

    /** Empty catalog recording why discovery failed. */
    public static AttributeCatalog unavailable(String warning) {
        return new AttributeCatalog(Collections.emptySet(), warning);
    }

    public Set<String> getNames() {
        return names;
    }

    public boolean isEmpty() {
        return names.isEmpty();
    }

    public boolean contains(String name) {
        return names.contains(name);
    }

    public Optional<String> getWarning() {
        return Optional.ofNullable(warning);
    }

    /** Names without the resource_ prefix. */
    public List<String> logAttributes() {
        return names.stream().filter(n -> !n.startsWith(RESOURCE_PREFIX)).collect(Collectors.toList());
    }

    /** Names carrying the resource_ prefix. */
    public List<String> resourceAttributes() {
        return names.stream().filter(n -> n.startsWith(RESOURCE_PREFIX)).collect(Collectors.toList());
    }
}
