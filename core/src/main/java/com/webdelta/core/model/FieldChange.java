package com.webdelta.core.model;

import java.util.Objects;

/** 단일 필드 차이 한 건 */
public final class FieldChange {
    private final SeoField field;
    private final String oldValue;
    private final String newValue;
    private final ChangeType changeType;

    public FieldChange(SeoField field, String oldValue, String newValue, ChangeType changeType) {
        this.field = Objects.requireNonNull(field, "field");
        this.oldValue = oldValue == null ? "" : oldValue;
        this.newValue = newValue == null ? "" : newValue;
        this.changeType = Objects.requireNonNull(changeType, "changeType");
    }

    public static FieldChange contentChange(SeoField field, String oldValue, String newValue) {
        return new FieldChange(field, oldValue, newValue, ChangeType.CONTENT_CHANGE);
    }

    public SeoField getField() { return field; }
    public String getOldValue() { return oldValue; }
    public String getNewValue() { return newValue; }
    public ChangeType getChangeType() { return changeType; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldChange c)) return false;
        return field == c.field && oldValue.equals(c.oldValue)
                && newValue.equals(c.newValue) && changeType == c.changeType;
    }

    @Override
    public int hashCode() { return Objects.hash(field, oldValue, newValue, changeType); }

    @Override
    public String toString() {
        return field.key() + ": '" + oldValue + "' -> '" + newValue + "' (" + changeType.wireName() + ")";
    }
}
