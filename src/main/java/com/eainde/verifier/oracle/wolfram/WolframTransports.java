package com.eainde.verifier.oracle.wolfram;

import java.time.Duration;

/**
 * Builds the transport for a configured {@link ResolutionTransport}.
 */
public final class WolframTransports {

    private WolframTransports() {
    }

    public static WolframTransport create(ResolutionTransport transport, Duration timeout) {
        if (transport instanceof ResolutionTransport.Remote remote) {
            return new RemoteWolframTransport(remote.endpoint(), timeout);
        }
        ResolutionTransport.Local local = (ResolutionTransport.Local) transport;
        return new LocalWolframTransport(
                LocalWolframTransport.resolveExecutable(local.executable(), System.getenv()), timeout);
    }
}
