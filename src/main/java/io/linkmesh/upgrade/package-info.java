/**
 * Upgrade reconciliation.
 *
 * <p>{@link io.linkmesh.upgrade.UpgradeReconciler} runs the stages in order: fetch the stored
 * config, repair the install record, merge recorded flags, apply overrides, resolve identity,
 * and build the values handed to the renderer. Stages fail fast with
 * {@link io.linkmesh.upgrade.UpgradeException}; caller bugs surface as
 * {@link java.lang.IllegalStateException}.
 */
package io.linkmesh.upgrade;
