package org.pragmatica.structmerge.tree;

import java.util.HashMap;
import java.util.Map;

/**
 * Capability table of a language: per node kind, how the matcher, merger and renderer
 * should treat nodes of that kind. Kinds not mentioned get {@link KindTraits#DEFAULT}.
 */
public final class KindTable {
    public static final KindTable EMPTY = builder().build();

    private final Map<String, KindTraits> traits;

    private KindTable(Map<String, KindTraits> traits) {
        this.traits = Map.copyOf(traits);
    }

    public KindTraits traits(String kind) {
        return traits.getOrDefault(kind, KindTraits.DEFAULT);
    }

    public boolean isAtomic(String kind) {
        return traits(kind).atomic();
    }

    public boolean isUnordered(String kind) {
        return traits(kind).isUnordered();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, KindTraits> traits = new HashMap<>();

        private Builder() {}

        public Builder atomic(String... kinds) {
            for (var kind : kinds) {
                traits.put(kind, current(kind).asAtomic());
            }
            return this;
        }

        public Builder unordered(String kind, String separator, String open, String close) {
            traits.put(kind, current(kind).asUnordered(separator, open, close));
            return this;
        }

        public Builder identity(String kind, String childKind) {
            traits.put(kind, current(kind).withIdentity(childKind));
            return this;
        }

        public KindTable build() {
            return new KindTable(traits);
        }

        private KindTraits current(String kind) {
            return traits.getOrDefault(kind, KindTraits.DEFAULT);
        }
    }
}
