package com.webdelta.core.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Arrays;
import java.util.Locale;

/** URL 범위 판정 + 비교용 정규화 + 파일 키 변환 유틸 */
public final class UrlUtils {
    private UrlUtils(){}

    /** 도메인 범위 판정: 단순 접두어 비교(대소문자 구분) */
    public static boolean inScope(String url, String baseUrl) {
        return url != null && baseUrl != null && url.startsWith(baseUrl);
    }

    /**
     * 접두어 치환: url이 fromPrefix로 시작하면 toPrefix로 바꾼다. 경로/쿼리는 그대로.
     * 시작하지 않으면 원본 유지.
     */
    public static String replacePrefix(String url, String fromPrefix, String toPrefix) {
        if (url == null || fromPrefix == null || toPrefix == null) return url;
        if (!url.startsWith(fromPrefix)) return url;
        return toPrefix + url.substring(fromPrefix.length());
    }

    /**
     * 비교용 정규화 키:
     * - scheme/host 소문자
     * - 기본 포트 제거(http:80, https:443)
     * - fragment 제거
     * - 끝 슬래시 제거(루트 "/"는 빈 경로와 동일 취급)
     * - 쿼리 파라미터 정렬
     * 파싱 실패 시 원본 문자열(보수적).
     */
    public static String matchKey(String url) {
        if (url == null) return null;
        URI u;
        try {
            u = new URI(url.trim());
        } catch (URISyntaxException e) {
            return url;
        }
        if (u.getScheme() == null || u.getHost() == null) return url;

        String scheme = u.getScheme().toLowerCase(Locale.ROOT);
        String host = u.getHost().toLowerCase(Locale.ROOT);
        int port = u.getPort();
        if ((scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443)) {
            port = -1; // 기본 포트 제거
        }

        String path = u.getRawPath() == null ? "" : u.getRawPath();
        while (path.endsWith("/")) path = path.substring(0, path.length() - 1);

        StringBuilder sb = new StringBuilder(url.length());
        sb.append(scheme).append("://").append(host);
        if (port != -1) sb.append(':').append(port);
        sb.append(path);

        String q = u.getRawQuery();
        if (q != null && !q.isEmpty()) {
            String[] parts = q.split("&");
            Arrays.sort(parts);
            sb.append('?').append(String.join("&", parts));
        }
        return sb.toString();
    }

    /** 스냅샷 파일 키: 영숫자 외 문자는 모두 '_' */
    public static String sanitizeKey(String url) {
        if (url == null) return "";
        return url.replaceAll("[^a-zA-Z0-9]", "_");
    }
}
