package io.github.harrbca.edicontext.x12.map;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

// Occurrence counts of loops and segments during one traversal, keyed by map path.
@Slf4j
public class LoopCounters {

    private final Map<String, Integer> counts = new HashMap<>();

    public int getCount(String path) {
        return counts.getOrDefault(path, 0);
    }

    public void setCount(String path, int count) {
        counts.put(path, count);
    }

    public int increment(String path) {
        return counts.merge(path, 1, Integer::sum);
    }

    public void reset(String path) {
        counts.remove(path);
    }

    // A new occurrence of the loop at path starts; everything nested in it counts from zero.
    public int enterLoop(String path) {
        resetDescendants(path);
        return increment(path);
    }

    public void resetDescendants(String path) {
        String prefix = path + "/";
        counts.keySet().removeIf(key -> key.startsWith(prefix));
    }

    public Map<String, Integer> snapshot() {
        return Collections.unmodifiableMap(new HashMap<>(counts));
    }

    // Counts to carry into target: every recorded path the target map also defines.
    public LoopCounters transferTo(X12Map target) {
        LoopCounters carried = new LoopCounters();
        counts.forEach((path, count) -> {
            if (target.hasPath(path)) {
                carried.setCount(path, count);
            } else {
                log.debug("Dropping count for {} not present in {}", path, target.getMapFile());
            }
        });
        return carried;
    }
}
