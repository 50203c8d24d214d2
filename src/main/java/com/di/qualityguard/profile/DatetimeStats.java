package com.di.qualityguard.profile;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/** Range and granularity of a datetime column; offset timestamps are expressed in UTC. */
@Value
@Builder
public class DatetimeStats {
    LocalDateTime min;
    LocalDateTime max;
    DatetimeGranularity granularity;
}
