package io.github.yok.clickload.core;

import com.google.common.collect.ImmutableList;
import java.util.Iterator;
import java.util.List;
import lombok.EqualsAndHashCode;

/**
 * Ordered list of concrete source locators chosen for one run. Iteration order is processing order.
 *
 * @author Yasuharu.Okawauchi
 */
@EqualsAndHashCode
public final class SourceManifest implements Iterable<String> {

    private final ImmutableList<String> locators;

    private SourceManifest(ImmutableList<String> locators) {
        this.locators = locators;
    }

    public static SourceManifest of(List<String> locators) {
        return new SourceManifest(ImmutableList.copyOf(locators));
    }

    public static SourceManifest of(String... locators) {
        return new SourceManifest(ImmutableList.copyOf(locators));
    }

    public List<String> getLocators() {
        return locators;
    }

    public boolean isEmpty() {
        return locators.isEmpty();
    }

    public int size() {
        return locators.size();
    }

    @Override
    public Iterator<String> iterator() {
        return locators.iterator();
    }

    @Override
    public String toString() {
        return locators.toString();
    }
}
