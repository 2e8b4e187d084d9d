/**
 * Application context package.
 *
 * <p>{@link io.quorumesh.runtime.QuorumMeshRuntime} builds storage, transport, audit log, clock and
 * settings once and passes them to the governance and cascade services used by the CLI.
 */
package io.quorumesh.runtime;
