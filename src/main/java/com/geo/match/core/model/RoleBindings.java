package com.geo.match.core.model;

import com.geo.match.exception.ConfigurationException;

import java.util.EnumMap;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Role to column-index bindings for one table.
 * An absent entry means the role is unbound.
 */
public class RoleBindings {

    private final Map<ColumnRole, Integer> bindings = new EnumMap<>(ColumnRole.class);

    /**
     * Binds a role to a column, replacing any previous binding.
     *
     * @throws ConfigurationException if the index is outside {@code [0, columnCount)}
     */
    public void bind(ColumnRole role, int columnIndex, int columnCount) {
        if (columnIndex < 0 || columnIndex >= columnCount) {
            throw new ConfigurationException("Column index " + columnIndex + " out of range for role "
                    + role.key() + " (columns: " + columnCount + ")");
        }
        bindings.put(role, columnIndex);
    }

    public void unbind(ColumnRole role) {
        bindings.remove(role);
    }

    public OptionalInt get(ColumnRole role) {
        Integer index = bindings.get(role);
        return index == null ? OptionalInt.empty() : OptionalInt.of(index);
    }

    public boolean isBound(ColumnRole role) {
        return bindings.containsKey(role);
    }

    /**
     * Drops bindings to a removed column and shifts bindings past it down by one.
     */
    void onColumnRemoved(int removedIndex) {
        bindings.entrySet().removeIf(e -> e.getValue() == removedIndex);
        bindings.replaceAll((role, index) -> index > removedIndex ? index - 1 : index);
    }
}
