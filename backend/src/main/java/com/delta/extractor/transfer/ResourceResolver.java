package com.delta.extractor.transfer;

import com.delta.extractor.model.JobState;
import com.delta.extractor.model.ResourceDescriptor;

import java.util.Optional;

/**
 * Re-derives a descriptor for a persisted job before it is resumed. Implementations may look
 * up a fresh URL for {@code resourceId} and {@code variantId}; an empty result skips the job.
 */
public interface ResourceResolver {
    Optional<ResourceDescriptor> resolve(JobState state);
}
