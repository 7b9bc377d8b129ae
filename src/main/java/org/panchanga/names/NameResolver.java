package org.panchanga.names;

/**
 * Capability contract mapping a numeric element index to a display name.
 *
 * <p>Names are presentation only: the engine must behave identically when every lookup falls back
 * to {@link NameCategory#fallbackName(int)}.</p>
 */
@FunctionalInterface
public interface NameResolver {

    /**
     * Resolves one element name.
     *
     * @param category element category.
     * @param index element number as produced by the engine.
     * @return table-defined name, or {@code <Category>-<index>} when the table has none.
     */
    String resolve(NameCategory category, int index);

    /**
     * Returns a resolver that always answers with the fallback name.
     */
    static NameResolver fallbackOnly() {
        return NameCategory::fallbackName;
    }
}
