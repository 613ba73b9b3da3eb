package com.witty.infrastructure.adapter;

import com.witty.domain.formalize.model.FormalizeOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves the adapter a request talks to. Reproducible mode always resolves the mock adapter.
 */
@Slf4j
@Component
public class AdapterRegistry {

    private final Map<String, TextInterpretationAdapter> adapters = new LinkedHashMap<>();

    public AdapterRegistry(List<TextInterpretationAdapter> available) {
        for (TextInterpretationAdapter adapter : available) {
            adapters.put(adapter.id(), adapter);
        }
        log.info("[AdapterRegistry] Adapters available: {}", adapters.keySet());
    }

    public Optional<TextInterpretationAdapter> resolve(FormalizeOptions options) {
        return Optional.ofNullable(adapters.get(options.effectiveAdapterId()));
    }

    public Set<String> ids() {
        return adapters.keySet();
    }
}
