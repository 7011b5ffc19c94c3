package io.linkmesh.upgrade;

import io.linkmesh.model.ControlPlaneConfigs;
import io.linkmesh.model.ReconciledValues;
import io.linkmesh.model.ResolvedIdentity;

import java.util.List;

public final class ValuesBuilder {
    private ValuesBuilder() {
    }

    /**
     * Must run after identity resolution so a freshly generated identity ends up in both the
     * global config and the identity values.
     */
    public static ReconciledValues build(
            String namespace,
            ControlPlaneConfigs configs,
            ResolvedIdentity identity,
            int controllerReplicas,
            List<String> warnings
    ) {
        return new ReconciledValues(
                namespace,
                configs.install(),
                configs.global().withIdentityContext(identity.context()),
                configs.proxy(),
                identity,
                controllerReplicas,
                warnings
        );
    }
}
