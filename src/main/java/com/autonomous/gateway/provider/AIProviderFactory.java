package com.autonomous.gateway.provider;

import com.autonomous.gateway.model.ProviderConfig;
import com.autonomous.gateway.model.ProviderType;

import java.util.function.Function;

public interface AIProviderFactory {

    /**
     * Builds a provider of the given type. The config must be the variant that type
     * expects; a mismatch surfaces as a {@link ClassCastException}.
     *
     * @throws com.autonomous.gateway.error.UnsupportedProviderException if nothing is registered for the type
     */
    AIProvider create(ProviderType type, ProviderConfig config);

    /**
     * Registers a constructor for the type, replacing any earlier registration.
     */
    void register(ProviderType type, Function<ProviderConfig, AIProvider> creator);

    boolean isRegistered(ProviderType type);
}
