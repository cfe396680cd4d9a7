package dev.tabsuite.formatter.align;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Resolved physical line: cell texts, each followed by its padding.
 */
public record LineLayout(List<Segment> segments) {

    public LineLayout {
        Objects.requireNonNull(segments, "segments");
        segments = List.copyOf(segments);
    }

    /**
     * Cell text followed by {@code padding} spaces.
     */
    public record Segment(String text, int padding) {

        public Segment {
            Objects.requireNonNull(text, "text");
            if (padding < 0) {
                throw new IllegalArgumentException("padding must be zero or greater");
            }
        }
    }

    /**
     * Joins the texts with a fixed gap, leaving no padding after the last one.
     */
    public static LineLayout fixed(List<String> texts, int gap) {
        Builder builder = new Builder();
        for (String text : texts) {
            builder.add(text, gap);
        }
        return builder.build();
    }

    public String render() {
        StringBuilder builder = new StringBuilder();
        for (Segment segment : segments) {
            builder.append(segment.text());
            builder.append(" ".repeat(segment.padding()));
        }
        return builder.toString();
    }

    public int width() {
        String rendered = render();
        return rendered.codePointCount(0, rendered.length());
    }

    public static final class Builder {

        private final List<Segment> segments = new ArrayList<>();

        public Builder add(String text, int padding) {
            segments.add(new Segment(text, padding));
            return this;
        }

        /**
         * Replaces the padding of the most recently added segment.
         */
        public Builder repad(int padding) {
            if (segments.isEmpty()) {
                throw new IllegalStateException("No segment to pad");
            }
            Segment last = segments.remove(segments.size() - 1);
            segments.add(new Segment(last.text(), padding));
            return this;
        }

        /**
         * Builds the layout; the last segment never carries trailing padding.
         */
        public LineLayout build() {
            if (!segments.isEmpty()) {
                repad(0);
            }
            return new LineLayout(segments);
        }
    }
}
