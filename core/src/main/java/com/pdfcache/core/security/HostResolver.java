package com.pdfcache.core.security;

import java.net.InetAddress;
import java.net.UnknownHostException;

/** 호스트명 → 모든 주소. 테스트에서는 고정 테이블로 대체한다. */
@FunctionalInterface
public interface HostResolver {

    HostResolver SYSTEM = InetAddress::getAllByName;

    InetAddress[] resolve(String host) throws UnknownHostException;
}
