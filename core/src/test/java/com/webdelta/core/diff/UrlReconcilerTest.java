package com.webdelta.core.diff;

import com.webdelta.core.model.Reconciliation;
import com.webdelta.core.model.UrlMatching;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("UrlReconciler: missing / new / common 분류")
class UrlReconcilerTest {

    private static final String D1 = "https://old.ex.com";
    private static final String D2 = "https://new.ex.com";

    @Test
    @DisplayName("구: {D1/, D1/about}, 신: {D2/, D2/contact}")
    void basicScenario() {
        Reconciliation r = new UrlReconciler().reconcile(
                List.of(D1 + "/", D1 + "/about"), D1,
                List.of(D2 + "/", D2 + "/contact"), D2);

        assertThat(r.missing()).containsExactly(D2 + "/about");
        assertThat(r.newUrls()).containsExactly(D2 + "/contact");
        assertThat(r.common()).containsExactly(D1 + "/");
    }

    @Test
    @DisplayName("rewrite는 접두어만 바꾸고 경로/쿼리는 유지")
    void rewriteKeepsRemainder() {
        assertThat(UrlReconciler.rewrite(D1 + "/a/b?x=1#f", D1, D2)).isEqualTo(D2 + "/a/b?x=1#f");
        // 접두어가 다르면 그대로
        assertThat(UrlReconciler.rewrite("https://elsewhere.com/a", D1, D2)).isEqualTo("https://elsewhere.com/a");
    }

    @Test
    @DisplayName("missing과 common은 원본을 나누고, new는 대상 중 대응 없는 것만")
    void partitionsAreComplete() {
        List<String> src = List.of(D1 + "/a", D1 + "/b", D1 + "/c", D1 + "/a");
        List<String> tgt = List.of(D2 + "/b", D2 + "/d", D2 + "/b");

        Reconciliation r = new UrlReconciler().reconcile(src, D1, tgt, D2);

        assertThat(r.common()).containsExactly(D1 + "/b");
        assertThat(r.missing()).containsExactly(D2 + "/a", D2 + "/c");
        assertThat(r.newUrls()).containsExactly(D2 + "/d");
        assertThat(r.missing().size() + r.common().size()).isEqualTo(3);
    }

    @Test
    @DisplayName("EXACT 매칭은 끝 슬래시/대소문자 차이를 다른 URL로 본다")
    void exactIsLiteral() {
        Reconciliation r = new UrlReconciler(UrlMatching.EXACT).reconcile(
                List.of(D1 + "/about/"), D1, List.of(D2 + "/about"), D2);

        assertThat(r.common()).isEmpty();
        assertThat(r.missing()).containsExactly(D2 + "/about/");
        assertThat(r.newUrls()).containsExactly(D2 + "/about");
    }

    @Test
    @DisplayName("NORMALIZED 매칭은 끝 슬래시/기본 포트/fragment/쿼리 순서를 무시")
    void normalizedMatching() {
        UrlReconciler rec = new UrlReconciler(UrlMatching.NORMALIZED);
        List<String> tgt = List.of(D2 + ":443/about", "HTTPS://NEW.EX.COM/list?b=2&a=1");

        Reconciliation r = rec.reconcile(List.of(D1 + "/about/", D1 + "/list?a=1&b=2#top"), D1, tgt, D2);

        assertThat(r.common()).containsExactly(D1 + "/about/", D1 + "/list?a=1&b=2#top");
        assertThat(r.missing()).isEmpty();
        assertThat(r.newUrls()).isEmpty();
        // 신규 사이트가 실제로 쓰는 표기를 찾는다
        assertThat(rec.counterpart(D1 + "/about/", D1, tgt, D2)).isEqualTo(D2 + ":443/about");
    }

    @Test
    @DisplayName("NORMALIZED에서 같은 페이지의 여러 표기는 첫 표기 하나로 센다")
    void normalizedDedupesBySpelling() {
        UrlReconciler rec = new UrlReconciler(UrlMatching.NORMALIZED);

        Reconciliation r = rec.reconcile(
                List.of(D1 + "/a", D1 + "/a/", D1 + "/gone", D1 + "/gone/"), D1,
                List.of(D2 + "/a", D2 + "/fresh", D2 + "/fresh/"), D2);

        assertThat(r.common()).containsExactly(D1 + "/a");
        assertThat(r.missing()).containsExactly(D2 + "/gone");
        assertThat(r.newUrls()).containsExactly(D2 + "/fresh");
    }

    @Test
    @DisplayName("EXACT에서 counterpart는 단순 rewrite")
    void exactCounterpart() {
        assertThat(new UrlReconciler().counterpart(D1 + "/x", D1, List.of(), D2)).isEqualTo(D2 + "/x");
    }

    @Test
    @DisplayName("빈 입력은 빈 결과")
    void emptyInputs() {
        Reconciliation r = new UrlReconciler().reconcile(List.of(), D1, List.of(), D2);
        assertThat(r.missing()).isEmpty();
        assertThat(r.newUrls()).isEmpty();
        assertThat(r.common()).isEmpty();
    }
}
