// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.poolinfo.common.errors;

import com.digitalasset.poolinfo.common.DomainError;

public final class FieldParseError extends DomainError {

    private final String field;
    private final String poolAddress;

    public FieldParseError(final String field, final String poolAddress, final String details) {
        super("FIELD_PARSE_ERROR", "pool " + poolAddress + ": field '" + field + "' " + details);
        this.field = field;
        this.poolAddress = poolAddress;
    }

    public String field() {
        return field;
    }

    public String poolAddress() {
        return poolAddress;
    }
}
