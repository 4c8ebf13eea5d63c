package com.webdelta.core.model;

/**
 * 비교 대상 SEO 필드.
 * key는 JSON/Markdown 산출물에 그대로 쓰이는 이름, metaName은 meta[name|property] 조회용.
 */
public enum SeoField {
    TITLE("title", null, "Title"),
    DESCRIPTION("description", "description", "Description"),
    KEYWORDS("keywords", "keywords", "Keywords"),
    H1("h1", null, "H1"),
    H2("h2", null, "H2"),
    CANONICAL("canonical", "canonical", "Canonical"),
    ROBOTS("robots", "robots", "Robots"),
    OG_TITLE("ogTitle", "og:title", "OG Title"),
    OG_DESCRIPTION("ogDescription", "og:description", "OG Description"),
    OG_IMAGE("ogImage", "og:image", "OG Image"),
    TWITTER_CARD("twitterCard", "twitter:card", "Twitter Card"),
    TWITTER_TITLE("twitterTitle", "twitter:title", "Twitter Title"),
    TWITTER_DESCRIPTION("twitterDescription", "twitter:description", "Twitter Description");

    private final String key;
    private final String metaName;   // null이면 meta 기반 필드가 아님
    private final String label;

    SeoField(String key, String metaName, String label) {
        this.key = key;
        this.metaName = metaName;
        this.label = label;
    }

    public String key() { return key; }
    public String metaName() { return metaName; }
    public String label() { return label; }
}
