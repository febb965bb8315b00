package io.storyarn.core.variable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/// Persistent, namespaced variable environment (`sheet.variable` addressing).
///
/// Every write returns a new store; the receiver is never modified. Storage is two
/// levels deep (sheet shortcut, then variable name) and a write copies only the top-level
/// index and the one sheet it touches. All other sheets are shared by reference with the
/// previous version, which keeps per-step snapshots cheap on projects with many sheets.
///
/// ### Contracts
/// - Reads of unknown variables return {@link Value#UNDEFINED}, never throw
/// - The engine never deletes variables
/// - A write must match the variable's declared {@link VariableType}
///
/// @implNote Immutable and thread-safe.
public final class VariableStore {

    private static final VariableStore EMPTY = new VariableStore(Map.of(), 0);

    private final Map<String, Map<String, Variable>> sheets;
    private final int size;

    private VariableStore(Map<String, Map<String, Variable>> sheets, int size) {
        this.sheets = sheets;
        this.size = size;
    }

    /// Returns the empty store.
    public static VariableStore empty() {
        return EMPTY;
    }

    /// Builds a store from declared variables.
    ///
    /// @param variables declarations, not null; later duplicates replace earlier ones
    /// @return new store, never null
    public static VariableStore of(Iterable<Variable> variables) {
        Map<String, Map<String, Variable>> building = new HashMap<>();
        for (Variable variable : variables) {
            building.computeIfAbsent(variable.key().sheet(), s -> new HashMap<>())
                    .put(variable.key().name(), variable);
        }
        Map<String, Map<String, Variable>> frozen = new HashMap<>();
        int count = 0;
        for (Map.Entry<String, Map<String, Variable>> entry : building.entrySet()) {
            frozen.put(entry.getKey(), Collections.unmodifiableMap(entry.getValue()));
            count += entry.getValue().size();
        }
        return new VariableStore(Collections.unmodifiableMap(frozen), count);
    }

    public static VariableStore of(Variable... variables) {
        return of(List.of(variables));
    }

    /// Reads a value.
    ///
    /// @param sheet sheet shortcut, not null
    /// @param name variable name, not null
    /// @return current value, {@link Value#UNDEFINED} if the variable is unknown
    public Value get(String sheet, String name) {
        Map<String, Variable> sheetVariables = sheets.get(sheet);
        if (sheetVariables == null) {
            return Value.UNDEFINED;
        }
        Variable variable = sheetVariables.get(name);
        return variable != null ? variable.value() : Value.UNDEFINED;
    }

    public Value get(VariableKey key) {
        return get(key.sheet(), key.name());
    }

    /// Looks up the full declaration of a variable.
    ///
    /// @param key variable address, not null
    /// @return the variable, or empty if it was never declared
    public Optional<Variable> find(VariableKey key) {
        Map<String, Variable> sheetVariables = sheets.get(key.sheet());
        return sheetVariables == null
                ? Optional.empty()
                : Optional.ofNullable(sheetVariables.get(key.name()));
    }

    public boolean contains(VariableKey key) {
        return find(key).isPresent();
    }

    /// Writes a value, returning a new store.
    ///
    /// Unknown variables are declared on the fly with the type inferred from `value`.
    ///
    /// @param sheet sheet shortcut, not null
    /// @param name variable name, not null
    /// @param value new value, not null
    /// @return new store sharing all untouched sheets with this one, never null
    /// @throws IllegalArgumentException if `value` does not match the declared type, or the
    ///     variable is unknown and `value` is undefined
    public VariableStore set(String sheet, String name, Value value) {
        return set(VariableKey.of(sheet, name), value);
    }

    public VariableStore set(VariableKey key, Value value) {
        Objects.requireNonNull(value, "value must not be null");
        Variable updated =
                find(key).map(v -> v.withValue(value))
                        .orElseGet(() -> Variable.of(key, VariableType.of(value), value));
        return put(updated);
    }

    /// Declares (or re-declares) a variable, returning a new store.
    ///
    /// @param variable the declaration including its value, not null
    /// @return new store, never null
    public VariableStore define(Variable variable) {
        Objects.requireNonNull(variable, "variable must not be null");
        return put(variable);
    }

    private VariableStore put(Variable variable) {
        String sheet = variable.key().sheet();
        Map<String, Variable> oldSheet = sheets.getOrDefault(sheet, Map.of());
        Map<String, Variable> newSheet = new HashMap<>(oldSheet);
        Variable previous = newSheet.put(variable.key().name(), variable);

        Map<String, Map<String, Variable>> newSheets = new HashMap<>(sheets);
        newSheets.put(sheet, Collections.unmodifiableMap(newSheet));
        return new VariableStore(
                Collections.unmodifiableMap(newSheets), previous == null ? size + 1 : size);
    }

    /// Returns every variable's value keyed by address, sorted by sheet then name.
    ///
    /// @return unmodifiable sorted view, never null
    public SortedMap<VariableKey, Value> snapshot() {
        SortedMap<VariableKey, Value> values = new TreeMap<>();
        sheets.values().forEach(s -> s.values().forEach(v -> values.put(v.key(), v.value())));
        return Collections.unmodifiableSortedMap(values);
    }

    /// Returns all declarations sorted by address.
    ///
    /// @return unmodifiable list, never null
    public List<Variable> variables() {
        List<Variable> all = new ArrayList<>(size);
        sheets.values().forEach(s -> all.addAll(s.values()));
        all.sort((a, b) -> a.key().compareTo(b.key()));
        return Collections.unmodifiableList(all);
    }

    /// Returns whether this store and `other` share the storage of `sheet`.
    ///
    /// @param other another store, not null
    /// @param sheet sheet shortcut, not null
    /// @return true if both stores point at the same sheet map
    public boolean sharesSheetWith(VariableStore other, String sheet) {
        Map<String, Variable> mine = sheets.get(sheet);
        return mine != null && mine == other.sheets.get(sheet);
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VariableStore other)) return false;
        return size == other.size && sheets.equals(other.sheets);
    }

    @Override
    public int hashCode() {
        return sheets.hashCode();
    }

    @Override
    public String toString() {
        return "VariableStore" + snapshot();
    }
}
