package com.eainde.verifier.workflow;

import com.eainde.verifier.claim.Claim;
import com.eainde.verifier.claim.ClaimCatalog;
import com.eainde.verifier.verdict.VerificationReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point for verifying claims.
 * <p>
 * Facade over the verification graph: callers pass a claim, or the name of a
 * catalog claim, and get back a {@link VerificationReport}. Every call runs on a
 * freshly created controller.
 * </p>
 */
@Slf4j
@Service
public class VerificationService {

    private final VerificationControllerFactory controllerFactory;
    private final ClaimCatalog catalog;

    public VerificationService(VerificationControllerFactory controllerFactory, ClaimCatalog catalog) {
        this.controllerFactory = controllerFactory;
        this.catalog = catalog;
    }

    public VerificationReport verify(Claim claim) {
        return controllerFactory.create().verify(claim);
    }

    /**
     * @throws IllegalArgumentException if the catalog has no claim with this name
     */
    public VerificationReport verify(String claimName) {
        Claim claim = catalog.find(claimName)
                .orElseThrow(() -> new IllegalArgumentException(
                        "No claim named '" + claimName + "', known: " + catalog.names()));
        return verify(claim);
    }
}
