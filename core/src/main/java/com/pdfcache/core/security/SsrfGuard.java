package com.pdfcache.core.security;

import com.pdfcache.core.error.BlockedUrlException;
import com.pdfcache.core.error.BlockedUrlException.Reason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.URI;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * SSRF 방어: 연결 전에 URL 을 검사한다.
 * <ol>
 *   <li>스킴은 http/https 만</li>
 *   <li>호스트 추출 가능해야 함</li>
 *   <li>localhost/127.0.0.1/::1/0.0.0.0 은 DNS 없이 차단</li>
 *   <li>DNS 로 모든 주소를 해석해 하나라도 내부 대역이면 차단. 해석 실패도 차단(fail-closed)</li>
 * </ol>
 * 리다이렉트 홉마다 "다음 대상"으로 다시 호출해야 TOCTOU 우회를 막을 수 있다.
 */
public final class SsrfGuard implements UrlGuard {

    private static final Logger LOG = LoggerFactory.getLogger(SsrfGuard.class);

    private static final Set<String> LOCAL_LITERALS = Set.of("localhost", "127.0.0.1", "::1", "0.0.0.0");

    // InetAddress 분류 메서드로 안 잡히는 예약/공유/문서화 대역
    private static final List<Cidr> BLOCKED_V4 = List.of(
            Cidr.parse("0.0.0.0/8"),
            Cidr.parse("10.0.0.0/8"),
            Cidr.parse("100.64.0.0/10"),     // CGNAT
            Cidr.parse("127.0.0.0/8"),
            Cidr.parse("169.254.0.0/16"),    // 169.254.169.254 메타데이터 포함
            Cidr.parse("172.16.0.0/12"),
            Cidr.parse("192.0.0.0/24"),
            Cidr.parse("192.0.2.0/24"),
            Cidr.parse("192.168.0.0/16"),
            Cidr.parse("198.18.0.0/15"),
            Cidr.parse("198.51.100.0/24"),
            Cidr.parse("203.0.113.0/24"),
            Cidr.parse("224.0.0.0/4"),
            Cidr.parse("240.0.0.0/4")        // 255.255.255.255 포함
    );

    private static final List<Cidr> BLOCKED_V6 = List.of(
            Cidr.parse("::/8"),              // ::, ::1, IPv4-compatible
            Cidr.parse("100::/64"),
            Cidr.parse("2001::/23"),
            Cidr.parse("2001:db8::/32"),
            Cidr.parse("fc00::/7"),          // unique local
            Cidr.parse("fe80::/10"),
            Cidr.parse("fec0::/10"),
            Cidr.parse("ff00::/8")
    );

    private final HostResolver resolver;

    public SsrfGuard() {
        this(HostResolver.SYSTEM);
    }

    public SsrfGuard(HostResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    @Override
    public void validate(String url) throws BlockedUrlException {
        if (url == null) {
            throw new BlockedUrlException(null, Reason.NO_HOST, "Could not extract hostname from URL: null");
        }
        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (Exception e) {
            throw new BlockedUrlException(url, Reason.NO_HOST, "Could not extract hostname from URL: " + url);
        }

        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new BlockedUrlException(url, Reason.SCHEME,
                    "Only HTTP and HTTPS URLs are allowed, got: " + scheme);
        }

        String host = extractHost(uri);
        if (host == null || host.isEmpty()) {
            throw new BlockedUrlException(url, Reason.NO_HOST, "Could not extract hostname from URL: " + url);
        }

        Reason blocked = classifyHost(host);
        if (blocked == null) return;
        switch (blocked) {
            case LOCALHOST:
                throw new BlockedUrlException(url, Reason.LOCALHOST, "URLs targeting localhost are not allowed: " + url);
            case UNRESOLVABLE:
                throw new BlockedUrlException(url, Reason.UNRESOLVABLE,
                        "URL host could not be resolved and is blocked: " + url);
            default:
                throw new BlockedUrlException(url, Reason.PRIVATE_ADDRESS,
                        "URL resolves to a private/reserved IP address and is blocked: " + url);
        }
    }

    /**
     * 순수 판정: 호스트가 내부 대역으로 해석되면 true.
     * 해석할 수 없으면 "안전하다고 판단할 수 없음" = true.
     */
    public boolean isBlockedHost(String host) {
        if (host == null || host.isBlank()) return true;
        return classifyHost(stripBrackets(host.trim().toLowerCase(Locale.ROOT))) != null;
    }

    /** validate 와 isBlockedHost 가 공유하는 분류. 허용이면 null. host 는 소문자, 괄호 없음 */
    private Reason classifyHost(String host) {
        if (LOCAL_LITERALS.contains(host)) return Reason.LOCALHOST;
        InetAddress[] addrs;
        try {
            addrs = resolver.resolve(host);
        } catch (UnknownHostException | SecurityException e) {
            LOG.debug("DNS resolution failed for {}: {}", host, e.toString());
            return Reason.UNRESOLVABLE;
        }
        if (addrs == null || addrs.length == 0) return Reason.UNRESOLVABLE;
        for (InetAddress a : addrs) {
            if (isBlockedAddress(a)) {
                LOG.warn("Blocked {} -> {}", host, a.getHostAddress());
                return Reason.PRIVATE_ADDRESS;
            }
        }
        return null;
    }

    /** 사설/루프백/링크로컬/예약/멀티캐스트 여부 */
    public static boolean isBlockedAddress(InetAddress a) {
        if (a == null) return true;
        if (a.isAnyLocalAddress() || a.isLoopbackAddress() || a.isLinkLocalAddress()
                || a.isSiteLocalAddress() || a.isMulticastAddress()) {
            return true;
        }
        byte[] raw = a.getAddress();
        List<Cidr> table = raw.length == 4 ? BLOCKED_V4 : BLOCKED_V6;
        for (Cidr c : table) {
            if (c.contains(raw)) return true;
        }
        return false;
    }

    /** URI.getHost()가 null 이어도(밑줄 등) authority 에서 호스트를 뽑는다. IPv6 괄호 제거, 소문자 */
    static String extractHost(URI uri) {
        String host = uri.getHost();
        if (host == null) {
            String auth = uri.getRawAuthority();
            if (auth == null || auth.isEmpty()) return null;
            int at = auth.lastIndexOf('@');
            if (at >= 0) auth = auth.substring(at + 1);
            if (auth.startsWith("[")) {
                int close = auth.indexOf(']');
                host = close > 0 ? auth.substring(0, close + 1) : auth;
            } else {
                int colon = auth.indexOf(':');
                host = colon >= 0 ? auth.substring(0, colon) : auth;
            }
        }
        return stripBrackets(host.toLowerCase(Locale.ROOT));
    }

    private static String stripBrackets(String h) {
        if (h.length() >= 2 && h.startsWith("[") && h.endsWith("]")) return h.substring(1, h.length() - 1);
        return h;
    }

    /** 바이트 단위 프리픽스 비교 */
    private record Cidr(byte[] network, int prefix) {

        static Cidr parse(String cidr) {
            int slash = cidr.indexOf('/');
            try {
                byte[] net = InetAddress.getByName(cidr.substring(0, slash)).getAddress();
                return new Cidr(net, Integer.parseInt(cidr.substring(slash + 1)));
            } catch (UnknownHostException e) {
                throw new IllegalArgumentException("bad CIDR literal: " + cidr, e);
            }
        }

        boolean contains(byte[] addr) {
            if (addr.length != network.length) return false;
            int full = prefix / 8;
            for (int i = 0; i < full; i++) {
                if (addr[i] != network[i]) return false;
            }
            int rem = prefix % 8;
            if (rem == 0) return true;
            int mask = (0xFF << (8 - rem)) & 0xFF;
            return (addr[full] & mask) == (network[full] & mask);
        }
    }
}
