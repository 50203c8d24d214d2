package com.di.qualityguard.profile;

import lombok.Builder;
import lombok.Value;

/** String-length summary. All fields are null when the column has no values. */
@Value
@Builder
public class TextStats {
    Integer minLength;
    Double meanLength;
    Integer maxLength;
}
