package com.profitrate.reconciliation.source;

import com.profitrate.reconciliation.core.model.ObservationSet;

/**
 * Loads one external source into a normalized {@link ObservationSet}.
 */
public interface SourceAdapter {

    /**
     * Loads the variable named by the descriptor.
     *
     * @param descriptor where the source lives and how to read it
     * @return the extracted observations, in the source's native unit
     * @throws SourceFormatException if the file does not match the declared layout
     */
    ObservationSet load(SourceDescriptor descriptor);
}
