package io.feedrecorder.ingestion.dto;

import java.util.List;

/**
 * One entry as handed over by the feed parser. Every field is optional and may be {@code null}.
 */
public record RawFeedEntry(
        String title,
        String author,
        String creator,
        String link,
        String published,
        String updated,
        String pubDate,
        String date,
        List<FeedTag> tags,
        List<String> categories
) {
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String title;
        private String author;
        private String creator;
        private String link;
        private String published;
        private String updated;
        private String pubDate;
        private String date;
        private List<FeedTag> tags;
        private List<String> categories;

        private Builder() {
        }

        public Builder title(String title) { this.title = title; return this; }
        public Builder author(String author) { this.author = author; return this; }
        public Builder creator(String creator) { this.creator = creator; return this; }
        public Builder link(String link) { this.link = link; return this; }
        public Builder published(String published) { this.published = published; return this; }
        public Builder updated(String updated) { this.updated = updated; return this; }
        public Builder pubDate(String pubDate) { this.pubDate = pubDate; return this; }
        public Builder date(String date) { this.date = date; return this; }
        public Builder tags(List<FeedTag> tags) { this.tags = tags; return this; }
        public Builder categories(List<String> categories) { this.categories = categories; return this; }

        public RawFeedEntry build() {
            return new RawFeedEntry(title, author, creator, link, published, updated, pubDate, date,
                    tags, categories);
        }
    }
}
