package com.delta.extractor.transfer;

import com.delta.extractor.model.JobState;
import com.delta.extractor.model.ResourceDescriptor;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class PersistedUrlResourceResolver implements ResourceResolver {

    @Override
    public Optional<ResourceDescriptor> resolve(JobState state) {
        if (state == null || state.resourceUrl() == null || state.resourceUrl().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new ResourceDescriptor(
            state.resourceId(),
            state.resourceUrl(),
            state.totalLength(),
            state.variantId()
        ));
    }
}
