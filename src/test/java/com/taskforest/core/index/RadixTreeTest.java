package com.taskforest.core.index;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RadixTreeTest {

    private RadixTree<String> tree;

    @BeforeEach
    void setUp() {
        tree = new RadixTree<>();
    }

    @Nested
    @DisplayName("put and get")
    class PutAndGet {

        @Test
        @DisplayName("stores and overwrites values")
        void storesAndOverwrites() {
            assertNull(tree.put("build", "v1"));
            assertEquals("v1", tree.put("build", "v2"));
            assertEquals("v2", tree.get("build"));
            assertEquals(1, tree.size());
        }

        @Test
        @DisplayName("splits edges where keys diverge")
        void splitsEdges() {
            tree.put("test", "1");
            tree.put("team", "2");
            tree.put("toast", "3");

            assertEquals("1", tree.get("test"));
            assertEquals("2", tree.get("team"));
            assertEquals("3", tree.get("toast"));
            assertNull(tree.get("te"));
            assertFalse(tree.containsKey("t"));
            assertEquals(3, tree.size());
            // root, "t", "e", "st", "am", "oast"
            assertEquals(6, tree.nodeCount());
        }

        @Test
        @DisplayName("a key that ends inside an edge becomes its own node")
        void keyInsideEdge() {
            tree.put("build module", "long");
            tree.put("build", "short");
            assertEquals("short", tree.get("build"));
            assertEquals("long", tree.get("build module"));
            assertEquals(2, tree.size());
        }
    }

    @Nested
    @DisplayName("prefix queries")
    class PrefixQueries {

        @BeforeEach
        void fill() {
            tree.put("build", "a");
            tree.put("build module", "b");
            tree.put("build module x", "c");
            tree.put("write tests", "d");
        }

        @Test
        @DisplayName("prefixesOf returns stored prefixes of the query, shortest first")
        void prefixesOf() {
            assertEquals(List.of("build", "build module", "build module x"),
                    tree.prefixesOf("build module x please"));
            assertEquals(Optional.of("build module x"), tree.longestPrefixOf("build module x please"));
            assertTrue(tree.prefixesOf("deploy").isEmpty());
        }

        @Test
        @DisplayName("keysWithPrefix walks the subtree in order and honours the limit")
        void keysWithPrefix() {
            assertEquals(List.of("build", "build module", "build module x"), tree.keysWithPrefix("bui", 10));
            assertEquals(List.of("build", "build module"), tree.keysWithPrefix("build", 2));
            assertTrue(tree.keysWithPrefix("buz", 10).isEmpty());
            assertEquals(4, tree.keysWithPrefix("", 10).size());
        }

        @Test
        @DisplayName("sharedPrefixLength counts partial edge matches")
        void sharedPrefixLength() {
            assertEquals(8, tree.sharedPrefixLength("build mob"));
            assertEquals(0, tree.sharedPrefixLength("zzz"));
        }
    }

    @Test
    @DisplayName("deep chains are walked without recursion")
    void deepChain() {
        int depth = 2000;
        for (int i = 1; i <= depth; i++) {
            tree.put("a".repeat(i), "v" + i);
        }
        assertEquals(depth, tree.prefixesOf("a".repeat(depth)).size());
        assertEquals(depth, tree.keysWithPrefix("a", depth + 1).size());
    }

    @Test
    @DisplayName("clear empties the tree")
    void clear() {
        tree.put("x", "1");
        tree.clear();
        assertTrue(tree.isEmpty());
        assertEquals(1, tree.nodeCount());
        assertNull(tree.get("x"));
    }
}
