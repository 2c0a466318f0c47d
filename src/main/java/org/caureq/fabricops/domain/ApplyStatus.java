package org.caureq.fabricops.domain;

/** What the network made of a commit, as far as the apply log knows. */
public enum ApplyStatus { PENDING, SUCCEEDED, FAILED }
