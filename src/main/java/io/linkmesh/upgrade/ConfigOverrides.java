package io.linkmesh.upgrade;

import io.linkmesh.flags.InstallOptions;
import io.linkmesh.model.AutoInjectContext;
import io.linkmesh.model.ControlPlaneConfigs;
import io.linkmesh.model.GlobalConfig;
import io.linkmesh.model.ProxyConfig;

/**
 * Applies the reconciled install options to the mutable parts of the stored config. The
 * identity context is not touched here; {@link IdentityReconciler} owns it.
 */
public final class ConfigOverrides {
    private ConfigOverrides() {
    }

    public static ControlPlaneConfigs apply(ControlPlaneConfigs configs, InstallOptions options, String namespace) {
        GlobalConfig global = configs.global().withOverrides(
                namespace,
                options.controlPlaneVersion(),
                options.omitWebhookSideEffects()
        );
        if (options.proxyAutoInject()) {
            global = global.withAutoInjectContext(new AutoInjectContext());
        }
        ProxyConfig proxy = configs.proxy().withOverrides(
                options.imagePullPolicy(),
                options.proxyLogLevel(),
                options.proxyUid(),
                options.proxyVersion()
        );
        return configs.withGlobal(global).withProxy(proxy);
    }
}
