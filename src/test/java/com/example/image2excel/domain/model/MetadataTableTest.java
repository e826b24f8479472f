package com.example.image2excel.domain.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MetadataTableTest {

    @Test
    void keepsInsertionOrderAndBlankRows() {
        MetadataTable table = MetadataTable.builder()
                .section("Header:")
                .add("b", "2")
                .add("a", "1")
                .blank()
                .add("a", "ignored duplicate")
                .build();

        assertThat(table.entries()).extracting(MetadataTable.Entry::label)
                .containsExactly("Header:", "b", "a", "", "a");
        assertThat(table.valueOf("a")).isEqualTo("1");
        assertThat(table.valueOf("missing")).isNull();
        assertThat(table.entries().get(3).value()).isEmpty();
    }
}
