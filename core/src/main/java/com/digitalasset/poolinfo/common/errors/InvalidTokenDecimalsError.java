// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.poolinfo.common.errors;

import com.digitalasset.poolinfo.common.DomainError;

public final class InvalidTokenDecimalsError extends DomainError {

    private final int decimals;

    public InvalidTokenDecimalsError(final int decimals) {
        super("INVALID_TOKEN_DECIMALS", "token decimals must be within [0, 18], got: " + decimals);
        this.decimals = decimals;
    }

    public int decimals() {
        return decimals;
    }
}
