package com.example.image2excel.domain.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered label/value pairs written to the Information sheet.
 * Insertion order is kept; a pair with an empty label and value renders as a blank row.
 */
public final class MetadataTable {

    private final List<Entry> entries;

    private MetadataTable(List<Entry> entries) {
        this.entries = List.copyOf(entries);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Entry> entries() {
        return entries;
    }

	/**
	 * Looks up the first value recorded for a label.
	 *
	 * @param label label to search
	 * @return value or {@code null} when the label is absent
	 */
    public String valueOf(String label) {
        return entries.stream()
                .filter(entry -> entry.label().equals(label))
                .map(Entry::value)
                .findFirst()
                .orElse(null);
    }

    public int size() {
        return entries.size();
    }

    /**
     * One row of the table.
     */
    public record Entry(String label, String value) {

        public Entry {
            label = Objects.requireNonNullElse(label, "");
            value = Objects.requireNonNullElse(value, "");
        }
    }

    /**
     * Accumulates entries while a conversion advances through its stages.
     */
    public static final class Builder {

        private final List<Entry> entries = new ArrayList<>();

        private Builder() {
        }

        public Builder add(String label, String value) {
            entries.add(new Entry(label, value));
            return this;
        }

        public Builder section(String title) {
            return add(title, "");
        }

        public Builder blank() {
            return add("", "");
        }

        public MetadataTable build() {
            return new MetadataTable(entries);
        }
    }
}
