package com.eainde.verifier.workflow;

import com.eainde.verifier.claim.Claim;
import com.eainde.verifier.claim.ClaimCatalog;
import com.eainde.verifier.verdict.ProofVerdict;
import com.eainde.verifier.verdict.VerificationReport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class VerificationServiceTest {

    @Mock
    private VerificationControllerFactory controllerFactory;

    @Mock
    private VerificationController controller;

    private final ClaimCatalog catalog = ClaimCatalog.defaults();

    @Test
    void verifiesCatalogClaimsByName() {
        Claim claim = catalog.find("p_series").orElseThrow();
        VerificationReport report = new VerificationReport("p_series", new ProofVerdict.Proved(0), 1, List.of());
        when(controllerFactory.create()).thenReturn(controller);
        when(controller.verify(claim)).thenReturn(report);

        assertThat(new VerificationService(controllerFactory, catalog).verify("p_series")).isSameAs(report);
    }

    @Test
    void rejectsUnknownNames() {
        VerificationService service = new VerificationService(controllerFactory, catalog);

        assertThatThrownBy(() -> service.verify("series_99"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("series_99")
                .hasMessageContaining("p_series");
        verifyNoInteractions(controllerFactory);
    }
}
