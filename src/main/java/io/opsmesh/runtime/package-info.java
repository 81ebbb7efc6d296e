/**
 * Composition root.
 *
 * <p>{@link io.opsmesh.runtime.OpsMeshRuntime} wires settings, storage, the bus, the agent
 * registry, emergency and conflict handling, the integration bridge and the coordination loop
 * into one lifecycle used by the CLI and by embedding applications.
 */
package io.opsmesh.runtime;
