/*
 * Copyright Storage Accessor Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.storageaccessor.kubernetes.webhook.selector;

import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The fields a field expression may refer to. Field names are case-insensitive, so {@code Name} and {@code name} are the same field.
 */
public enum SelectorField {

    NAME("name", SelectorTarget::name),
    STATUS("status", SelectorTarget::status);

    private final String fieldName;
    private final Function<SelectorTarget, String> accessor;

    SelectorField(String fieldName, Function<SelectorTarget, String> accessor) {
        this.fieldName = fieldName;
        this.accessor = accessor;
    }

    Optional<String> valueOf(SelectorTarget target) {
        return Optional.ofNullable(accessor.apply(target));
    }

    public static Optional<SelectorField> forName(@Nullable String name) {
        if (name == null) {
            return Optional.empty();
        }
        String lowerCased = name.toLowerCase(Locale.ROOT);
        for (SelectorField field : values()) {
            if (field.fieldName.equals(lowerCased)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }
}
