package com.webdelta.core.model;

import java.util.List;
import java.util.Objects;

/** 공통 URL 한 쌍의 비교 결과. url은 신규 사이트 기준 */
public final class ComparisonResult {
    private final String url;
    private final List<FieldChange> changes;

    public ComparisonResult(String url, List<FieldChange> changes) {
        this.url = Objects.requireNonNull(url, "url");
        this.changes = List.copyOf(changes == null ? List.of() : changes);
    }

    public String getUrl() { return url; }
    public List<FieldChange> getChanges() { return changes; }
    public boolean hasChanges() { return !changes.isEmpty(); }

    public boolean touches(SeoField field) {
        for (FieldChange c : changes) if (c.getField() == field) return true;
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ComparisonResult r)) return false;
        return url.equals(r.url) && changes.equals(r.changes);
    }

    @Override
    public int hashCode() { return Objects.hash(url, changes); }

    @Override
    public String toString() { return "ComparisonResult{" + url + ", " + changes + "}"; }
}
