package com.tradecontrol.domain.model;

import java.math.BigDecimal;
import lombok.Value;

@Value
public class ExposureSnapshot {

    int openPositionCount;
    BigDecimal openNotional;

    public static ExposureSnapshot empty() {
        return new ExposureSnapshot(0, BigDecimal.ZERO);
    }
}
