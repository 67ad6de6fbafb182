package com.spicegui.circuit;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DisjointSetTest {

    @Test
    void unionIsTransitive() {
        DisjointSet<String> s = new DisjointSet<>();
        s.union("a", "b");
        s.union("c", "d");
        assertThat(s.connected("a", "c")).isFalse();
        s.union("b", "d");
        assertThat(s.connected("a", "c")).isTrue();
        assertThat(s.find("a")).isEqualTo(s.find("d"));
    }

    @Test
    void groupsKeepRegistrationOrder() {
        DisjointSet<Integer> s = new DisjointSet<>();
        for (int i = 0; i < 6; i++) s.add(i);
        s.union(4, 0);
        s.union(5, 1);
        List<List<Integer>> g = s.groups();
        assertThat(g).containsExactly(List.of(0, 4), List.of(1, 5), List.of(2), List.of(3));
    }

    @Test
    void growsPastInitialCapacity() {
        DisjointSet<Integer> s = new DisjointSet<>();
        for (int i = 1; i < 100; i++) s.union(i - 1, i);
        assertThat(s.size()).isEqualTo(100);
        assertThat(s.groups()).hasSize(1);
    }

    @Test
    void unknownKeys() {
        DisjointSet<String> s = new DisjointSet<>();
        s.add("x");
        assertThat(s.connected("x", "y")).isFalse();
        assertThatThrownBy(() -> s.find("y")).isInstanceOf(IllegalArgumentException.class);
    }
}
