/**
 * QuorumMesh: knowledge governance (proposals, quorum voting, versioned facts) and stage-gated cascading
 * tasks for peer agents sharing a message bus.
 */
package io.quorumesh;
