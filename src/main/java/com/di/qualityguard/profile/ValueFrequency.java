package com.di.qualityguard.profile;

import lombok.Value;

/** One entry of a top-N frequency list. {@code share} is relative to the non-null count. */
@Value
public class ValueFrequency {
    String value;
    long count;
    double share;
}
