package com.xpdustry.wordgrid.common.trie;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class WordTrieImplTest {

    private static final List<String> WORDS = List.of("cat", "car", "cart", "dog");

    @Test
    void test_contains_word_and_prefix() {
        final var trie = WordTrie.create(WORDS);
        Assertions.assertTrue(trie.containsWord("cat"));
        Assertions.assertFalse(trie.containsWord("ca"));
        Assertions.assertTrue(trie.containsPrefix("ca"));
        Assertions.assertTrue(trie.containsPrefix("do"));
        Assertions.assertTrue(trie.containsWord("dog"));
        Assertions.assertFalse(trie.containsPrefix("x"));
        Assertions.assertTrue(trie.containsWord("car"));
        Assertions.assertTrue(trie.containsWord("cart"));
        Assertions.assertFalse(trie.containsWord("carts"));
        Assertions.assertFalse(trie.containsPrefix("carts"));
    }

    @Test
    void test_every_prefix_is_contained() {
        final var trie = WordTrie.create(WORDS);
        for (final var word : WORDS) {
            for (int i = 1; i <= word.length(); i++) {
                Assertions.assertTrue(trie.containsPrefix(word.substring(0, i)), word.substring(0, i));
            }
            Assertions.assertTrue(trie.containsWord(word));
        }
        Assertions.assertFalse(trie.containsPrefix("cb"));
        Assertions.assertFalse(trie.containsPrefix("dot"));
        Assertions.assertFalse(trie.containsPrefix("a"));
    }

    @Test
    void test_step_traversal() {
        final var trie = WordTrie.create(WORDS);

        final var first = trie.step(null, 'c');
        Assertions.assertTrue(first.potentialPrefix());
        Assertions.assertFalse(first.completesWord());

        final var second = trie.step(first.node(), 'a');
        Assertions.assertTrue(second.potentialPrefix());
        Assertions.assertFalse(second.completesWord());

        final var third = trie.step(second.node(), 't');
        Assertions.assertTrue(third.potentialPrefix());
        Assertions.assertTrue(third.completesWord());
        Assertions.assertNotNull(third.node());
        Assertions.assertEquals("cat", third.node().word());
        Assertions.assertEquals(trie.containsWord("cat"), third.node().completesWord());
    }

    @Test
    void test_step_miss() {
        final var trie = WordTrie.create(WORDS);
        Assertions.assertEquals(WordTrie.Step.MISS, trie.step(null, 'x'));
        final var cat = trie.find("cat");
        Assertions.assertEquals(WordTrie.Step.MISS, trie.step(cat, 'z'));
        Assertions.assertNull(WordTrie.Step.MISS.node());
        Assertions.assertFalse(WordTrie.Step.MISS.potentialPrefix());
        Assertions.assertFalse(WordTrie.Step.MISS.completesWord());
    }

    @Test
    void test_step_from_root_handle() {
        final var trie = WordTrie.create(WORDS);
        Assertions.assertEquals(trie.step(null, 'd'), trie.step(trie.root(), 'd'));
    }

    @Test
    void test_step_matches_contains_word() {
        final var trie = WordTrie.create(List.of("tea", "team", "teams", "ten", "to", "tot"));
        for (final var text : List.of("t", "te", "tea", "team", "teams", "ten", "to", "tot", "tote")) {
            TrieNode node = null;
            WordTrie.Step step = WordTrie.Step.MISS;
            for (int i = 0; i < text.length(); i++) {
                step = trie.step(node, text.charAt(i));
                node = step.node();
                if (node == null) {
                    break;
                }
            }
            Assertions.assertEquals(trie.containsWord(text), step.completesWord(), text);
            Assertions.assertEquals(trie.containsPrefix(text), step.potentialPrefix(), text);
            if (node != null) {
                Assertions.assertEquals(text, node.word());
            }
        }
    }

    @Test
    void test_single_letter_word() {
        final var trie = WordTrie.create(List.of("a"));
        Assertions.assertTrue(trie.containsWord("a"));
        Assertions.assertFalse(trie.containsPrefix(""));
        Assertions.assertFalse(trie.containsWord(""));
    }

    @Test
    void test_blank_text_never_matches() {
        final var trie = WordTrie.create(WORDS);
        Assertions.assertFalse(trie.containsPrefix("   "));
        Assertions.assertFalse(trie.containsWord("\t"));
        Assertions.assertNull(trie.find(" "));
    }

    @Test
    void test_insert_after_seal() {
        final var builder = WordTrie.builder();
        builder.insert("cat");
        final var trie = builder.seal();
        Assertions.assertTrue(trie.containsWord("cat"));
        assertThatThrownBy(() -> builder.insert("dog")).isInstanceOf(SealedTrieException.class);
        trie.containsPrefix("c");
        trie.step(null, 'c');
        assertThatThrownBy(() -> builder.insert("dog")).isInstanceOf(SealedTrieException.class);
        assertThatThrownBy(() -> builder.insertAll(List.of("dog"))).isInstanceOf(SealedTrieException.class);
        Assertions.assertFalse(trie.containsWord("dog"));
    }

    @Test
    void test_seal_twice() {
        final var builder = WordTrie.builder().insert("cat");
        builder.seal();
        assertThatThrownBy(builder::seal).isInstanceOf(SealedTrieException.class);
    }

    @Test
    void test_insert_is_idempotent() {
        final var once = WordTrie.create(List.of("cat"));
        final var twice = WordTrie.create(List.of("cat", "cat"));
        Assertions.assertEquals(1, twice.size());
        Assertions.assertEquals(once.nodeCount(), twice.nodeCount());
        Assertions.assertEquals(once.containsWord("cat"), twice.containsWord("cat"));
        Assertions.assertEquals(once.containsPrefix("ca"), twice.containsPrefix("ca"));
    }

    @Test
    void test_insertion_order_does_not_matter() {
        final var forward = WordTrie.create(WORDS);
        final var reversed = new ArrayList<>(WORDS);
        Collections.reverse(reversed);
        final var backward = WordTrie.create(reversed);
        for (final var text : List.of("c", "ca", "cat", "car", "cart", "d", "dog", "dot", "x")) {
            Assertions.assertEquals(forward.containsWord(text), backward.containsWord(text), text);
            Assertions.assertEquals(forward.containsPrefix(text), backward.containsPrefix(text), text);
        }
        Assertions.assertEquals(forward.nodeCount(), backward.nodeCount());
    }

    @Test
    void test_size_and_node_count() {
        final var trie = WordTrie.create(WORDS);
        Assertions.assertEquals(4, trie.size());
        // root, c, a, t, r, t, d, o, g
        Assertions.assertEquals(9, trie.nodeCount());
        Assertions.assertEquals(0, WordTrie.builder().seal().size());
        Assertions.assertEquals(1, WordTrie.builder().seal().nodeCount());
    }

    @Test
    void test_word_that_is_also_a_prefix() {
        final var trie = WordTrie.create(List.of("cat", "cats"));
        final var cat = trie.find("cat");
        Assertions.assertNotNull(cat);
        Assertions.assertTrue(cat.completesWord());
        Assertions.assertTrue(cat.hasChildren());
        final var cats = cat.child('s');
        Assertions.assertNotNull(cats);
        Assertions.assertTrue(cats.completesWord());
        Assertions.assertFalse(cats.hasChildren());
    }

    @Test
    void test_root_node() {
        final var trie = WordTrie.create(WORDS);
        final var root = trie.root();
        Assertions.assertTrue(root.isRoot());
        Assertions.assertEquals("", root.word());
        Assertions.assertEquals(Alphabet.NO_SYMBOL, root.symbol());
        Assertions.assertFalse(root.completesWord());
        Assertions.assertNull(root.parent());
        Assertions.assertEquals(0, root.depth());
    }

    @Test
    void test_node_navigation() {
        final var trie = WordTrie.create(WORDS);
        final var cart = trie.find("cart");
        Assertions.assertNotNull(cart);
        Assertions.assertEquals('t', cart.symbol());
        Assertions.assertEquals(4, cart.depth());
        Assertions.assertFalse(cart.isRoot());
        final var car = cart.parent();
        Assertions.assertNotNull(car);
        Assertions.assertEquals("car", car.word());
        Assertions.assertEquals(cart, car.child('t'));
        Assertions.assertNull(car.child('z'));
        Assertions.assertNull(trie.find("cab"));
        Assertions.assertNull(trie.find(""));
    }

    @Test
    void test_node_equality() {
        final var trie = WordTrie.create(WORDS);
        final var walked = trie.step(trie.step(trie.step(null, 'c').node(), 'a').node(), 't').node();
        Assertions.assertEquals(trie.find("cat"), walked);
        Assertions.assertEquals(trie.find("cat").hashCode(), walked.hashCode());
        Assertions.assertNotEquals(trie.find("car"), walked);
        Assertions.assertNotEquals(WordTrie.create(WORDS).find("cat"), walked);
    }

    @Test
    void test_node_from_other_trie() {
        final var trie = WordTrie.create(WORDS);
        final var other = WordTrie.create(WORDS).find("ca");
        assertThatThrownBy(() -> trie.step(other, 't')).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void test_invalid_symbol_in_query() {
        final var trie = WordTrie.create(WORDS);
        assertThatThrownBy(() -> trie.containsWord("Cat"))
                .isInstanceOfSatisfying(InvalidSymbolException.class, e -> {
                    assertThat(e.symbol()).isEqualTo('C');
                    assertThat(e.index()).isEqualTo(0);
                });
        assertThatThrownBy(() -> trie.containsPrefix("c4")).isInstanceOf(InvalidSymbolException.class);
        assertThatThrownBy(() -> trie.step(null, '!')).isInstanceOf(InvalidSymbolException.class);
        assertThatThrownBy(() -> trie.step(trie.find("cart"), 'T')).isInstanceOf(InvalidSymbolException.class);
    }

    @Test
    void test_invalid_word_is_not_inserted() {
        final var builder = WordTrie.builder();
        assertThatThrownBy(() -> builder.insert("ca-t"))
                .isInstanceOfSatisfying(InvalidSymbolException.class, e -> assertThat(e.index())
                        .isEqualTo(2));
        final var trie = builder.seal();
        Assertions.assertFalse(trie.containsPrefix("c"));
        Assertions.assertEquals(0, trie.size());
        Assertions.assertEquals(1, trie.nodeCount());
    }

    @Test
    void test_insert_empty_word() {
        assertThatThrownBy(() -> WordTrie.builder().insert("")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void test_concurrent_queries() throws Exception {
        final List<String> words = new ArrayList<>();
        for (char a = 'a'; a <= 'f'; a++) {
            for (char b = 'a'; b <= 'f'; b++) {
                for (char c = 'a'; c <= 'f'; c++) {
                    words.add(new String(new char[] {a, b, c}));
                }
            }
        }
        final var trie = WordTrie.create(words);
        final var executor = Executors.newFixedThreadPool(8);
        try {
            final List<Callable<Boolean>> tasks = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                tasks.add(() -> {
                    for (final var word : words) {
                        final var node = trie.step(trie.step(trie.step(null, word.charAt(0)).node(), word.charAt(1))
                                        .node(), word.charAt(2))
                                .node();
                        if (!trie.containsWord(word) || node == null || !word.equals(node.word())) {
                            return false;
                        }
                    }
                    return !trie.containsPrefix("g");
                });
            }
            for (final var future : executor.invokeAll(tasks)) {
                Assertions.assertTrue(future.get());
            }
        } finally {
            executor.shutdownNow();
        }
        Assertions.assertEquals(216, trie.size());
    }
}
