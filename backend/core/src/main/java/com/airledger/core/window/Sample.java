package com.airledger.core.window;

import com.airledger.core.model.MetContext;

import java.time.Instant;

record Sample(Instant timestamp, double value, MetContext met) {
}
