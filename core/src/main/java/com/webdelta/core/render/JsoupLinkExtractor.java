package com.webdelta.core.render;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** JSoup 링크 추출기: a[href], area[href] → abs:href 수집 (문서 순서, 중복 제거) */
public final class JsoupLinkExtractor {

    public List<String> extract(Document doc) {
        Set<String> out = new LinkedHashSet<>();
        if (doc == null) return new ArrayList<>(out);

        for (Element a : doc.select("a[href], area[href]")) {
            String abs = a.attr("abs:href");
            if (abs == null || abs.isBlank()) continue;
            abs = abs.trim();
            try {
                URI u = URI.create(abs);
                String s = u.getScheme();
                if (s == null) continue;
                if (!s.equalsIgnoreCase("http") && !s.equalsIgnoreCase("https")) continue;
                out.add(abs);
            } catch (IllegalArgumentException ignore) {
                // 잘못된 URL은 무시
            }
        }
        return new ArrayList<>(out);
    }
}
