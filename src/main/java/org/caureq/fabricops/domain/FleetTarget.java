package org.caureq.fabricops.domain;

/** One unit of fan-out work: push a committed artifact to a device. */
public record FleetTarget(DeviceDescriptor device, String commitId, ConfigurationArtifact artifact) {}
