package org.panchanga.names;

import java.util.List;
import java.util.Objects;

/**
 * Name resolver backed by an immutable {@link NameTable}.
 *
 * <p>Karana naming is irregular: explicit table entries win (the fixed names 1, 58, 59, 60), and
 * karanas 2-57 otherwise repeat the seven-name cycle. Any index the table cannot name resolves to
 * {@code <Category>-<index>}.</p>
 */
public final class TableNameResolver implements NameResolver {
    static final int FIRST_CYCLIC_KARANA = 2;
    static final int LAST_CYCLIC_KARANA = 57;

    private final NameTable nameTable;

    /**
     * Creates a resolver over one table.
     */
    public TableNameResolver(NameTable nameTable) {
        this.nameTable = Objects.requireNonNull(nameTable, "nameTable");
    }

    /**
     * Returns a resolver over the bundled default table.
     */
    public static TableNameResolver defaults() {
        return new TableNameResolver(NameTable.defaults());
    }

    @Override
    public String resolve(NameCategory category, int index) {
        Objects.requireNonNull(category, "category");
        String name = nameTable.name(category, index);
        if (name != null) {
            return name;
        }
        if (category == NameCategory.KARANA) {
            String cyclic = cyclicKaranaName(index);
            if (cyclic != null) {
                return cyclic;
            }
        }
        return category.fallbackName(index);
    }

    private String cyclicKaranaName(int index) {
        List<String> cycle = nameTable.karanaCycle();
        if (cycle.isEmpty() || index < FIRST_CYCLIC_KARANA || index > LAST_CYCLIC_KARANA) {
            return null;
        }
        return cycle.get((index - FIRST_CYCLIC_KARANA) % cycle.size());
    }
}
