package com.cape.core.registry;

import com.cape.core.model.CapabilityDescriptor;

import java.util.List;

/**
 * Supplies descriptors to the registry at startup. Parsing capability
 * packages from disk or a catalogue is the implementation's concern; the
 * registry only sees finished descriptors.
 */
public interface CapabilitySource {

    /**
     * Short name used in log lines.
     */
    default String name() {
        return getClass().getSimpleName();
    }

    List<CapabilityDescriptor> descriptors();
}
