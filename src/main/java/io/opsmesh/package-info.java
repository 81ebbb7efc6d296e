/**
 * OpsMesh source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.opsmesh.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.opsmesh.cli.OpsMeshCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.opsmesh.runtime.OpsMeshRuntime} wires every component into one lifecycle.</li>
 *   <li>{@code io.opsmesh.supervisor.OperationalSupervisor} runs the periodic coordination cycle.</li>
 *   <li>{@code io.opsmesh.bridge.IntegrationBridge} owns the resilient path to the external validator.</li>
 * </ul>
 */
package io.opsmesh;
