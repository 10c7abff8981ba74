// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.poolinfo.common;

import java.util.Objects;

/**
 * Carries a {@link DomainError} out of the pure normalization pipeline.
 * Converted back into a {@link Result} at the service boundary.
 */
public class NormalizationException extends RuntimeException {

    private final transient DomainError error;

    public NormalizationException(final DomainError error) {
        super(Objects.requireNonNull(error, "error").toString());
        this.error = error;
    }

    public NormalizationException(final DomainError error, final Throwable cause) {
        super(Objects.requireNonNull(error, "error").toString(), cause);
        this.error = error;
    }

    public DomainError error() {
        return error;
    }
}
