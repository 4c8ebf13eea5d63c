package com.webdelta.core.extract;

import com.webdelta.core.model.FieldRecord;
import com.webdelta.core.model.FieldSchema;
import com.webdelta.core.model.SeoField;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * HTML → 스키마 고정 FieldRecord.
 * 전함수(total): 어떤 입력에도 예외를 던지지 않는다.
 * 태그/속성이 없으면 빈 문자열, 내부 오류 시 extractionFailed 표식이 붙은 빈 레코드.
 */
public class FieldExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(FieldExtractor.class);

    private final FieldSchema schema;

    public FieldExtractor(FieldSchema schema) {
        this.schema = Objects.requireNonNull(schema, "schema");
    }

    public FieldSchema getSchema() { return schema; }

    public FieldRecord extract(String html) {
        try {
            Document doc = Jsoup.parse(html == null ? "" : html);
            FieldRecord.Builder b = FieldRecord.builder(schema);
            for (SeoField f : schema.fields()) {
                b.put(f, valueOf(doc, f));
            }
            return b.build();
        } catch (RuntimeException e) {
            LOG.warn("Field extraction failed, substituting empty record: {}", e.toString());
            return FieldRecord.failed(schema);
        }
    }

    protected String valueOf(Document doc, SeoField f) {
        switch (f) {
            case TITLE:
                return doc.title();
            case H1:
                return firstText(doc, "h1");
            case H2:
                return firstText(doc, "h2");
            case CANONICAL: {
                Element link = doc.selectFirst("link[rel=canonical]");
                if (link != null) return link.attr("href").trim();
                return metaContent(doc, f.metaName());
            }
            default:
                return metaContent(doc, f.metaName());
        }
    }

    /** meta[name=X] 또는 meta[property=X] 중 문서상 첫 번째의 content */
    static String metaContent(Document doc, String name) {
        if (name == null) return "";
        for (Element m : doc.select("meta[name], meta[property]")) {
            if (name.equals(m.attr("name")) || name.equals(m.attr("property"))) {
                return m.attr("content");
            }
        }
        return "";
    }

    static String firstText(Document doc, String tag) {
        Element e = doc.selectFirst(tag);
        return e == null ? "" : e.text().trim();
    }
}
