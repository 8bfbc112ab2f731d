package com.clapgrow.channels.whatsapp.ingress.extract;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Ordered list of extractors tried one after another until one yields a value.
 *
 * <p>Extraction never throws: a failing extractor is skipped and the chain falls back to
 * the caller's default.
 */
@Slf4j
public final class ExtractorChain<T> {

    public record Step<T>(String name, Function<JsonNode, Optional<T>> extractor) {
    }

    private final String name;
    private final List<Step<T>> steps;

    private ExtractorChain(String name, List<Step<T>> steps) {
        this.name = name;
        this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
    }

    public static <T> Builder<T> named(String name) {
        return new Builder<>(name);
    }

    public T extract(JsonNode node, T defaultValue) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return defaultValue;
        }
        for (Step<T> step : steps) {
            try {
                Optional<T> value = step.extractor().apply(node);
                if (value != null && value.isPresent()) {
                    return value.get();
                }
            } catch (RuntimeException e) {
                log.debug("Extractor {}.{} failed: {}", name, step.name(), e.getMessage());
            }
        }
        return defaultValue;
    }

    public static final class Builder<T> {
        private final String name;
        private final List<Step<T>> steps = new ArrayList<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder<T> then(String stepName, Function<JsonNode, Optional<T>> extractor) {
            steps.add(new Step<>(stepName, extractor));
            return this;
        }

        public ExtractorChain<T> build() {
            return new ExtractorChain<>(name, steps);
        }
    }
}
