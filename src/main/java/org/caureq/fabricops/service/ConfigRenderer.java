package org.caureq.fabricops.service;

import org.caureq.fabricops.domain.ChangeRequest;

import java.util.List;

/** Turns port intent into device-native command lines. Must be deterministic and side-effect free. */
public interface ConfigRenderer {

    List<String> render(ChangeRequest request);
}
