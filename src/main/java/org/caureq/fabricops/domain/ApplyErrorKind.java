package org.caureq.fabricops.domain;

public enum ApplyErrorKind { UNREACHABLE, TIMEOUT, REJECTED, INTERNAL }
