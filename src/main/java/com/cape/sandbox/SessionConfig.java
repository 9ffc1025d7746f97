package com.cape.sandbox;

import com.cape.core.model.CapabilityDescriptor;
import com.cape.core.model.ResourceLimits;
import com.cape.core.model.RiskLevel;

import java.time.Duration;

/**
 * Settings a session is created with. Only the first {@code getOrCreate}
 * for a session id applies them; later callers reuse the live session.
 *
 * @param backend        backend name, resolved with {@link IsolationBackend#fromName(String)}
 * @param limits         memory, CPU and network constraints
 * @param timeout        default wall-clock limit for executions without their own
 * @param riskLevel      risk of the capability that opened the session
 */
public record SessionConfig(String backend, ResourceLimits limits, Duration timeout, RiskLevel riskLevel) {

    public SessionConfig {
        limits = limits == null ? ResourceLimits.defaults() : limits;
        timeout = timeout == null ? Duration.ofSeconds(CapabilityDescriptor.DEFAULT_TIMEOUT_SECONDS) : timeout;
        riskLevel = riskLevel == null ? RiskLevel.LOW : riskLevel;
    }

    public static SessionConfig of(String backend) {
        return new SessionConfig(backend, null, null, null);
    }

    /**
     * Session settings for a capability, using {@code defaultBackend} when it
     * does not request one.
     */
    public static SessionConfig forCapability(CapabilityDescriptor descriptor, String defaultBackend) {
        String backend = descriptor.isolation() != null ? descriptor.isolation() : defaultBackend;
        return new SessionConfig(backend, descriptor.limits(),
                Duration.ofSeconds(descriptor.timeoutSeconds()), descriptor.riskLevel());
    }
}
