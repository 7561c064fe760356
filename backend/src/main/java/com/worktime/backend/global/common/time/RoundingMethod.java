package com.worktime.backend.global.common.time;

public enum RoundingMethod {
    NEAREST,
    UP,
    DOWN
}
