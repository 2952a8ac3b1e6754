package com.sitescope.crawler.crawl.sampling;

public enum PostType {
    BLOG_POST("blog-post"),
    PRODUCT("product"),
    CATEGORY("category"),
    SERVICE("service"),
    ABOUT("about"),
    DOCUMENTATION("documentation"),
    HOMEPAGE("homepage"),
    SECTION("section"),
    CONTENT("content"),
    OTHER("other");

    private final String label;

    PostType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
