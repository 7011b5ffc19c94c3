package io.linkmesh.render;

import io.linkmesh.model.ReconciledValues;
import io.linkmesh.upgrade.UpgradeException;

/**
 * Turns reconciled values into manifest text. Implementations build the whole document in
 * memory; callers only print it once rendering returned.
 */
public interface ManifestRenderer {
    String render(ReconciledValues values) throws UpgradeException;
}
