// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.poolinfo.common.errors;

import com.digitalasset.poolinfo.common.DomainError;

public final class ArrayLengthMismatchError extends DomainError {

    public ArrayLengthMismatchError(final String details) {
        super("ARRAY_LENGTH_MISMATCH", details);
    }
}
