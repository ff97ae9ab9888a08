package com.last9.mcpserver.validation;

import com.last9.mcpserver.catalog.AttributeCatalog;
import lombok.experimental.UtilityClass;

import java.util.Optional;

/**
 * Matches a field reference against the attribute catalog, accounting for the bracket and
 * resource_ naming forms.
 */
@UtilityClass
class AttributeFieldMatcher {

    private static final String ATTRIBUTES = "attributes";
    private static final String RESOURCE_ATTRIBUTES = "resource_attributes";

    /**
     * Acceptance rules, first match wins:
     * <ol>
     *   <li>verbatim catalog entry</li>
     *   <li>{@code attributes['x']} or {@code attributes["x"]}: x or resource_x cataloged</li>
     *   <li>{@code resource_attributes['x']}: resource_x or x cataloged</li>
     *   <li>{@code resource_x}: x cataloged</li>
     * </ol>
     */
    static boolean isAllowed(String field, AttributeCatalog catalog) {
        if (catalog.contains(field)) {
            return true;
        }
        Optional<String> attr = bracketKey(field, ATTRIBUTES);
        if (attr.isPresent()) {
            return catalog.contains(attr.get()) || catalog.contains(AttributeCatalog.RESOURCE_PREFIX + attr.get());
        }
        Optional<String> resourceAttr = bracketKey(field, RESOURCE_ATTRIBUTES);
        if (resourceAttr.isPresent()) {
            return catalog.contains(AttributeCatalog.RESOURCE_PREFIX + resourceAttr.get())
                    || catalog.contains(resourceAttr.get());
        }
        if (field.startsWith(AttributeCatalog.RESOURCE_PREFIX)) {
            return catalog.contains(field.substring(AttributeCatalog.RESOURCE_PREFIX.length()));
        }
        return false;
    }

    /**
     * Extract x from {@code name['x']} or {@code name["x"]}. Empty keys do not match.
     */
    static Optional<String> bracketKey(String field, String name) {
        for (char quote : new char[]{'\'', '"'}) {
            String prefix = name + "[" + quote;
            String suffix = quote + "]";
            if (field.startsWith(prefix) && field.endsWith(suffix)
                    && field.length() > prefix.length() + suffix.length()) {
                return Optional.of(field.substring(prefix.length(), field.length() - suffix.length()));
            }
        }
        return Optional.empty();
    }
}
