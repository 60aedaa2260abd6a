package com.pdfcache.core.cache;

/** 만료 판정용 시계. 테스트에서는 고정 시계를 주입한다. */
@FunctionalInterface
public interface CacheClock {

    CacheClock SYSTEM = System::currentTimeMillis;

    long nowMillis();
}
