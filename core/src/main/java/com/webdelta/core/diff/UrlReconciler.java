package com.webdelta.core.diff;

import com.webdelta.core.model.Reconciliation;
import com.webdelta.core.model.UrlMatching;
import com.webdelta.core.util.UrlUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * 두 도메인 간 URL 대응 및 분류(missing / new / common).
 * rewrite(u) = targetDomain + (u에서 sourceDomain 접두어를 뗀 나머지).
 * 출력은 입력 순서를 유지하고 매칭 키 기준으로 중복을 제거한다(첫 표기 유지).
 */
public final class UrlReconciler {

    private final UrlMatching matching;

    public UrlReconciler() {
        this(UrlMatching.EXACT);
    }

    public UrlReconciler(UrlMatching matching) {
        this.matching = Objects.requireNonNull(matching, "matching");
    }

    public static String rewrite(String url, String sourceDomain, String targetDomain) {
        return UrlUtils.replacePrefix(url, sourceDomain, targetDomain);
    }

    public Reconciliation reconcile(Collection<String> sourceUrls, String sourceDomain,
                                    Collection<String> targetUrls, String targetDomain) {
        Objects.requireNonNull(sourceUrls, "sourceUrls");
        Objects.requireNonNull(targetUrls, "targetUrls");
        Objects.requireNonNull(sourceDomain, "sourceDomain");
        Objects.requireNonNull(targetDomain, "targetDomain");

        Set<String> targetKeys = new LinkedHashSet<>();
        for (String t : targetUrls) targetKeys.add(key(t));

        Set<String> rewrittenKeys = new LinkedHashSet<>();
        Set<String> missing = new LinkedHashSet<>();
        Set<String> common = new LinkedHashSet<>();
        for (String u : sourceUrls) {
            String r = rewrite(u, sourceDomain, targetDomain);
            String k = key(r);
            // 같은 키의 다른 표기는 첫 번째만 남긴다
            if (!rewrittenKeys.add(k)) continue;
            if (targetKeys.contains(k)) common.add(u);
            else missing.add(r);
        }

        Set<String> fresh = new LinkedHashSet<>();
        Set<String> freshKeys = new LinkedHashSet<>();
        for (String t : targetUrls) {
            String k = key(t);
            if (!rewrittenKeys.contains(k) && freshKeys.add(k)) fresh.add(t);
        }

        return new Reconciliation(new ArrayList<>(missing), new ArrayList<>(fresh), new ArrayList<>(common));
    }

    /**
     * common URL(구 도메인)에 대응하는 신규 사이트 URL.
     * NORMALIZED 매칭에서는 신규 사이트가 실제로 쓰는 표기를 돌려준다.
     */
    public String counterpart(String sourceUrl, String sourceDomain,
                              Collection<String> targetUrls, String targetDomain) {
        String r = rewrite(sourceUrl, sourceDomain, targetDomain);
        if (matching == UrlMatching.EXACT) return r;
        String k = key(r);
        for (String t : targetUrls) if (key(t).equals(k)) return t;
        return r;
    }

    private String key(String url) {
        return matching == UrlMatching.NORMALIZED ? UrlUtils.matchKey(url) : url;
    }
}
