package au.org.ala.imagedate.metadata;

import java.util.List;
import java.util.Optional;

/**
 * Consults several tag stores in order; the first one holding a tag wins.
 */
public class CompositeTagLookup implements TagLookup {

    private final List<TagLookup> delegates;

    public CompositeTagLookup(TagLookup... delegates) {
        this.delegates = List.of(delegates);
    }

    @Override
    public Optional<Object> lookup(int tagCode) {
        for (TagLookup delegate : delegates) {
            Optional<Object> value = delegate.lookup(tagCode);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }
}
