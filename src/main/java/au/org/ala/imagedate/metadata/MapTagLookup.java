package au.org.ala.imagedate.metadata;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A {@link TagLookup} over an in-memory map of tag code to value.
 */
public class MapTagLookup implements TagLookup {

    private final Map<Integer, Object> tags = new HashMap<>();

    public MapTagLookup() {
    }

    public MapTagLookup(Map<Integer, ?> tags) {
        this.tags.putAll(tags);
    }

    public MapTagLookup with(int tagCode, Object value) {
        tags.put(tagCode, value);
        return this;
    }

    @Override
    public Optional<Object> lookup(int tagCode) {
        return Optional.ofNullable(tags.get(tagCode));
    }

    @Override
    public String toString() {
        return "MapTagLookup" + tags;
    }
}
