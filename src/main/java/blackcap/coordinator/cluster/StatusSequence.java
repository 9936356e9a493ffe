package blackcap.coordinator.cluster;

import com.google.common.base.Suppliers;

import java.util.Iterator;
import java.util.List;
import java.util.function.Supplier;

/**
 * Lazy status sequence: the backend is queried on first iteration, and later iterations
 * replay the same values.
 */
public final class StatusSequence implements Iterable<String> {

    private final Supplier<List<String>> values;

    public StatusSequence(Supplier<List<String>> fetch) {
        this.values = Suppliers.memoize(fetch::get);
    }

    public static StatusSequence of(List<String> values) {
        List<String> copy = List.copyOf(values);
        return new StatusSequence(() -> copy);
    }

    @Override
    public Iterator<String> iterator() {
        return values.get().iterator();
    }
}
