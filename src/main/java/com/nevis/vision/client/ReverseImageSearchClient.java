package com.nevis.vision.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.nevis.vision.availability.HealthProbe;
import com.nevis.vision.model.ReverseSearchProvider;
import com.nevis.vision.model.Capability;
import com.nevis.vision.model.ImageSource;
import com.nevis.vision.model.ReverseSearchOptions;

/**
 * Reverse image search over one provider. Implementations return the provider's raw payload.
 */
public interface ReverseImageSearchClient extends HealthProbe {

    ReverseSearchProvider provider();

    JsonNode search(ImageSource source, ReverseSearchOptions options);

    @Override
    default String backendId() {
        return Capability.SEARCH_REVERSE_IMAGE.getBackendId();
    }
}
