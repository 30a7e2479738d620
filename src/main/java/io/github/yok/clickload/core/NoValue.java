package io.github.yok.clickload.core;

/**
 * Explicit "no value" marker for a coerced cell.
 *
 * <p>
 * Distinct from an empty string and from zero. The destination store receives SQL {@code NULL} for
 * it.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public enum NoValue {
    INSTANCE;

    /**
     * Checks whether a coerced cell carries no value.
     *
     * @param cell coerced cell
     * @return {@code true} for {@link #INSTANCE}
     */
    public static boolean is(Object cell) {
        return cell == INSTANCE;
    }

    @Override
    public String toString() {
        return "NoValue";
    }
}
