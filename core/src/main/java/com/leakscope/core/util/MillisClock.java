package com.leakscope.core.util;

/** 테스트에서 시간을 고정/전진시키기 위한 밀리초 시계. */
@FunctionalInterface
public interface MillisClock {
    long nowMillis();

    MillisClock SYSTEM = System::currentTimeMillis;
}
