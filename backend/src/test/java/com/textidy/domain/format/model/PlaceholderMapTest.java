package com.textidy.domain.format.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlaceholderMapTest {

    @Test
    @DisplayName("mint: each original gets a distinct token without ASCII characters")
    void mint_distinctTokens() {
        PlaceholderMap.Builder builder = PlaceholderMap.builder('\uE000', '\uE001');
        String first = builder.mint("Li-S");
        String second = builder.mint("X-ray");

        assertThat(first).isNotEqualTo(second);
        assertThat(first.chars().allMatch(c -> c > 127)).isTrue();
        assertThat(second.chars().allMatch(c -> c > 127)).isTrue();
    }

    @Test
    @DisplayName("expand: tokens are replaced and reported")
    void expand_replacesTokens() {
        PlaceholderMap.Builder builder = PlaceholderMap.builder('\uE000', '\uE001');
        String token = builder.mint("HKUST-1");
        PlaceholderMap map = builder.build();

        Set<String> restored = new HashSet<>();
        String expanded = map.expand("MOF " + token + " sample", restored);

        assertThat(expanded).isEqualTo("MOF HKUST-1 sample");
        assertThat(restored).containsExactly(token);
    }

    @Test
    @DisplayName("expand: more than ten tokens keep distinct indexes")
    void expand_manyTokens() {
        PlaceholderMap.Builder builder = PlaceholderMap.builder('\uE000', '\uE001');
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < 12; i++) {
            text.append(builder.mint("v" + i)).append(' ');
        }
        PlaceholderMap map = builder.build();

        assertThat(map.size()).isEqualTo(12);
        assertThat(map.expand(text.toString())).isEqualTo("v0 v1 v2 v3 v4 v5 v6 v7 v8 v9 v10 v11 ");
    }

    @Test
    @DisplayName("displayWidth: token counts as the width of its original")
    void displayWidth_usesOriginal() {
        PlaceholderMap.Builder builder = PlaceholderMap.builder('\uE000', '\uE001');
        String token = builder.mint("Ti₃C₂Tₓ");
        PlaceholderMap map = builder.build();

        assertThat(map.displayWidth(token)).isEqualTo(7);
        assertThat(map.displayWidth("ab" + token)).isEqualTo(9);
    }

    @Test
    @DisplayName("builder: identical sentinels are rejected")
    void builder_sameSentinels() {
        assertThatThrownBy(() -> PlaceholderMap.builder('\uE000', '\uE000'))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("empty map leaves text alone")
    void empty_noop() {
        assertThat(PlaceholderMap.empty().expand("a-b")).isEqualTo("a-b");
        assertThat(PlaceholderMap.empty().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("spansLines: true only when a token's original holds a line break")
    void spansLines() {
        PlaceholderMap.Builder builder = PlaceholderMap.builder('\uE000', '\uE001');
        String block = builder.mint("a\nb");
        String inline = builder.mint("$x$");
        PlaceholderMap map = builder.build();

        assertThat(map.spansLines("  " + block)).isTrue();
        assertThat(map.spansLines("see " + inline)).isFalse();
        assertThat(map.spansLines("plain\ntext")).isFalse();
    }
}
