package cloud.tokendispenser.sdk.discovery;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Directory stub keeping entries in insertion order.
 */
public final class InMemoryParameterDirectory implements ParameterDirectory {

    private final Map<String, String> entries = new LinkedHashMap<>();
    public final AtomicInteger getCalls = new AtomicInteger();
    public final AtomicInteger listCalls = new AtomicInteger();
    public volatile int lastLimit;

    public InMemoryParameterDirectory put(String name, String value) {
        entries.put(name, value);
        return this;
    }

    @Override
    public Optional<String> get(String path) {
        getCalls.incrementAndGet();
        return Optional.ofNullable(entries.get(path));
    }

    @Override
    public Map<String, String> listUnder(String prefix, int limit) {
        listCalls.incrementAndGet();
        lastLimit = limit;
        String base = prefix.endsWith("/") ? prefix : prefix + "/";
        Map<String, String> found = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : entries.entrySet()) {
            if (entry.getKey().startsWith(base) && found.size() < limit) {
                found.put(entry.getKey(), entry.getValue());
            }
        }
        return found;
    }
}
