package com.webdelta.core.diff;

import com.webdelta.core.model.ComparisonResult;
import com.webdelta.core.model.FieldChange;
import com.webdelta.core.model.FieldRecord;
import com.webdelta.core.model.FieldSchema;
import com.webdelta.core.model.SeoField;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 필드 단위 비교. 순수/결정적, 부작용 없음.
 * 스키마 순서대로 값이 다른 필드마다 content_change 한 건.
 */
public final class FieldDiffer {

    public ComparisonResult compare(FieldRecord oldRecord, FieldRecord newRecord, String url) {
        Objects.requireNonNull(oldRecord, "oldRecord");
        Objects.requireNonNull(newRecord, "newRecord");
        if (oldRecord.schema() != newRecord.schema()) {
            throw new IllegalArgumentException("schema mismatch: " + oldRecord.schema() + " vs " + newRecord.schema());
        }
        FieldSchema schema = oldRecord.schema();
        List<FieldChange> changes = new ArrayList<>(schema.size());
        for (SeoField f : schema.fields()) {
            String o = oldRecord.get(f);
            String n = newRecord.get(f);
            if (!o.equals(n)) changes.add(FieldChange.contentChange(f, o, n));
        }
        return new ComparisonResult(url, changes);
    }
}
