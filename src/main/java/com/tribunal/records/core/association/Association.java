package com.tribunal.records.core.association;

import lombok.Value;

/**
 * A (left, right) pair stored in a link table.
 */
@Value(staticConstructor = "of")
public class Association {
    long leftId;
    long rightId;
}
