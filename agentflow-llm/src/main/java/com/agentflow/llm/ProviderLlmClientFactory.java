package com.agentflow.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Dispatches to a per-provider factory by {@link LlmOptions#getProvider()}. Immutable after {@link Builder#build()}.
 */
public final class ProviderLlmClientFactory implements LlmClientFactory {

    private static final Logger log = LoggerFactory.getLogger(ProviderLlmClientFactory.class);

    private final Map<String, LlmClientFactory> byProvider;

    private ProviderLlmClientFactory(Map<String, LlmClientFactory> byProvider) {
        this.byProvider = Collections.unmodifiableMap(new LinkedHashMap<>(byProvider));
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public LlmClient create(LlmOptions options) {
        Objects.requireNonNull(options, "options");
        LlmClientFactory delegate = byProvider.get(options.getProvider());
        if (delegate == null) {
            throw new LlmException("No LLM client registered for provider '" + options.getProvider()
                    + "'. Registered: " + byProvider.keySet());
        }
        return delegate.create(options);
    }

    public Set<String> providers() {
        return byProvider.keySet();
    }

    public static final class Builder {
        private final Map<String, LlmClientFactory> byProvider = new LinkedHashMap<>();

        public Builder register(String provider, LlmClientFactory factory) {
            Objects.requireNonNull(provider, "provider");
            Objects.requireNonNull(factory, "factory");
            byProvider.put(provider, factory);
            log.info("Registered LLM provider | provider={}", provider);
            return this;
        }

        public ProviderLlmClientFactory build() {
            return new ProviderLlmClientFactory(byProvider);
        }
    }
}
