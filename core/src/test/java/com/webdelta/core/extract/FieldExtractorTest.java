package com.webdelta.core.extract;

import com.webdelta.core.model.FieldRecord;
import com.webdelta.core.model.FieldSchema;
import com.webdelta.core.model.SeoField;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("FieldExtractor: HTML에서 SEO 필드 추출")
class FieldExtractorTest {

    private static final String FULL_PAGE = """
        <html><head>
          <title>  Home Page </title>
          <meta name="description" content="Best widgets">
          <meta name="keywords" content="widgets, tools">
          <meta name="robots" content="index,follow">
          <link rel="canonical" href=" https://ex.com/ ">
          <meta property="og:title" content="OG Home">
          <meta property="og:description" content="OG desc">
          <meta property="og:image" content="https://ex.com/i.png">
          <meta name="twitter:card" content="summary">
          <meta name="twitter:title" content="TW Home">
          <meta name="twitter:description" content="TW desc">
        </head><body>
          <h1> Welcome <b>all</b> </h1><h1>second</h1>
          <h2>Sub</h2>
        </body></html>
        """;

    @Test
    @DisplayName("FULL 스키마 13개 필드 모두 채움")
    void extractsAllFields() {
        FieldRecord r = new FieldExtractor(FieldSchema.FULL).extract(FULL_PAGE);

        assertThat(r.isExtractionFailed()).isFalse();
        assertThat(r.asMap()).hasSize(13);
        assertThat(r.get(SeoField.TITLE)).isEqualTo("Home Page");
        assertThat(r.get(SeoField.DESCRIPTION)).isEqualTo("Best widgets");
        assertThat(r.get(SeoField.KEYWORDS)).isEqualTo("widgets, tools");
        assertThat(r.get(SeoField.H1)).isEqualTo("Welcome all");
        assertThat(r.get(SeoField.H2)).isEqualTo("Sub");
        assertThat(r.get(SeoField.CANONICAL)).isEqualTo("https://ex.com/");
        assertThat(r.get(SeoField.ROBOTS)).isEqualTo("index,follow");
        assertThat(r.get(SeoField.OG_TITLE)).isEqualTo("OG Home");
        assertThat(r.get(SeoField.OG_DESCRIPTION)).isEqualTo("OG desc");
        assertThat(r.get(SeoField.OG_IMAGE)).isEqualTo("https://ex.com/i.png");
        assertThat(r.get(SeoField.TWITTER_CARD)).isEqualTo("summary");
        assertThat(r.get(SeoField.TWITTER_TITLE)).isEqualTo("TW Home");
        assertThat(r.get(SeoField.TWITTER_DESCRIPTION)).isEqualTo("TW desc");
    }

    @Test
    @DisplayName("없는 태그/속성은 빈 문자열")
    void missingFieldsAreEmpty() {
        FieldRecord r = new FieldExtractor(FieldSchema.FULL).extract("<html><body><p>hi</p></body></html>");

        assertThat(r.isExtractionFailed()).isFalse();
        for (SeoField f : FieldSchema.FULL.fields()) {
            assertThat(r.get(f)).as(f.key()).isEmpty();
        }
    }

    @Test
    @DisplayName("빈 입력/null에도 예외 없이 빈 레코드")
    void emptyInput() {
        FieldExtractor x = new FieldExtractor(FieldSchema.FULL);
        assertThat(x.extract("").asMap()).hasSize(13).allSatisfy((k, v) -> assertThat(v).isEmpty());
        assertThat(x.extract(null).isExtractionFailed()).isFalse();
    }

    @Test
    @DisplayName("REDUCED 스키마는 9개 필드만")
    void reducedSchema() {
        FieldRecord r = new FieldExtractor(FieldSchema.REDUCED).extract(FULL_PAGE);

        assertThat(r.asMap()).hasSize(9);
        assertThat(r.asMap()).doesNotContainKeys("ogImage", "twitterCard", "twitterTitle", "twitterDescription");
        assertThat(r.get(SeoField.OG_DESCRIPTION)).isEqualTo("OG desc");
    }

    @Test
    @DisplayName("같은 HTML은 같은 레코드")
    void deterministic() {
        FieldExtractor x = new FieldExtractor(FieldSchema.FULL);
        assertThat(x.extract(FULL_PAGE)).isEqualTo(x.extract(FULL_PAGE));
    }

    @Test
    @DisplayName("canonical은 link 우선, 없으면 meta")
    void canonicalFallsBackToMeta() {
        FieldExtractor x = new FieldExtractor(FieldSchema.FULL);
        String metaOnly = "<html><head><meta name=\"canonical\" content=\"https://ex.com/m\"></head></html>";
        assertThat(x.extract(metaOnly).get(SeoField.CANONICAL)).isEqualTo("https://ex.com/m");
    }

    @Test
    @DisplayName("같은 이름의 meta가 여럿이면 첫 번째")
    void firstMetaWins() {
        String html = "<head><meta property=\"description\" content=\"first\">"
                + "<meta name=\"description\" content=\"second\"></head>";
        assertThat(new FieldExtractor(FieldSchema.FULL).extract(html).get(SeoField.DESCRIPTION)).isEqualTo("first");
    }

    @Test
    @DisplayName("내부 오류는 실패 표식이 붙은 빈 레코드로")
    void internalFaultIsTagged() {
        FieldExtractor broken = new FieldExtractor(FieldSchema.REDUCED) {
            @Override protected String valueOf(Document doc, SeoField f) {
                throw new IllegalStateException("boom");
            }
        };

        FieldRecord r = broken.extract(FULL_PAGE);

        assertThat(r.isExtractionFailed()).isTrue();
        assertThat(r.asMap()).hasSize(9).allSatisfy((k, v) -> assertThat(v).isEmpty());
    }
}
