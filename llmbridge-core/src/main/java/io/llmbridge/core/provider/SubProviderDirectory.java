package io.llmbridge.core.provider;

import io.llmbridge.core.error.ProviderException;
import java.util.List;

/**
 * Implemented by routing gateways that can enumerate the upstream hosts serving a model.
 */
public interface SubProviderDirectory {

    /**
     * @return sorted, de-duplicated sub-provider names; empty when the model has no endpoints
     */
    List<String> listSubProviders(String modelId) throws ProviderException;
}
