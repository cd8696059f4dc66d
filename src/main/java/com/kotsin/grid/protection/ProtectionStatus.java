package com.kotsin.grid.protection;

import com.kotsin.grid.model.BarDirection;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class ProtectionStatus {
    boolean protectionActive;
    Instant hibernationStart;
    double elapsedHours;
    double remainingHours;

    Double baselineVolatility;
    double currentVolatility;
    Double recoveryThreshold;

    BarDirection direction;
    int barCount;
    double cumulativeMovePercent;
    Double runStartPrice;
    Instant runStartTime;
    Instant lastBarTime;

    double extremeThreshold;
    double hibernationHours;
    double recoveryMultiplier;
}
