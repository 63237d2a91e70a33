package com.raditha.baker.config;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable table of function names known to be potentially non-deterministic.
 * <p>
 * Instances are safe to share between concurrent analyses. Use
 * {@link #toBuilder()} to derive an extended or reduced catalogue.
 */
public final class DeterminismCatalogue {

    private static final DeterminismCatalogue DEFAULT = builder()
            .always("rand")
            .unlessArguments("date", 2)
            .unlessArguments("localtime", 1)
            .always("time")
            .always("microtime")
            .always("gettimeofday")
            .unlessArguments("getdate", 1)
            .unlessArguments("gmdate", 2)
            .unlessArguments("gmmktime", 6)
            .unlessArguments("gmstrftime", 2)
            .unlessArguments("idate", 2)
            .unlessArguments("mktime", 6)
            .unlessArguments("strftime", 2)
            .unlessArguments("strtotime", 2)
            .always("curl_exec")
            .always("shuffle")
            .always("str_shuffle")
            .unlessArguments("easter_date", 1)
            .unlessArguments("easter_days", 1)
            .always("array_rand")
            .always("lcg_value")
            .always("gmp_random")
            .always("mt_rand")
            .always("random_int")
            .always("random_bytes")
            .build();

    private final Map<String, DeterminismRule> rules;

    private DeterminismCatalogue(Map<String, DeterminismRule> rules) {
        this.rules = Map.copyOf(rules);
    }

    /**
     * The built-in catalogue of clock, random and external-state functions.
     */
    public static DeterminismCatalogue defaults() {
        return DEFAULT;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Look up a function name, ignoring case.
     */
    public Optional<DeterminismRule> lookup(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(rules.get(name.toLowerCase(Locale.ROOT)));
    }

    public boolean contains(String name) {
        return lookup(name).isPresent();
    }

    public int size() {
        return rules.size();
    }

    public Collection<DeterminismRule> rules() {
        return rules.values();
    }

    /**
     * Start a builder pre-populated with this catalogue's rules.
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        rules.values().forEach(builder::rule);
        return builder;
    }

    /**
     * Mutable builder; later rules replace earlier ones with the same name.
     */
    public static final class Builder {
        private final Map<String, DeterminismRule> rules = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder rule(DeterminismRule rule) {
            rules.put(rule.name(), rule);
            return this;
        }

        public Builder always(String name) {
            return rule(DeterminismRule.always(name));
        }

        public Builder unlessArguments(String name, int threshold) {
            return rule(DeterminismRule.unlessArguments(name, threshold));
        }

        public Builder remove(String name) {
            rules.remove(name.toLowerCase(Locale.ROOT));
            return this;
        }

        public Builder clear() {
            rules.clear();
            return this;
        }

        public DeterminismCatalogue build() {
            return new DeterminismCatalogue(rules);
        }
    }
}
