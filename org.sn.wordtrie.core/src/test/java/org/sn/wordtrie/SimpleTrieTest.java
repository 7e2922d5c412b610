package org.sn.wordtrie;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.sn.wordtrie.testutils.TestUtil.assertException;
import static org.sn.wordtrie.testutils.TestUtil.toList;

import java.util.ConcurrentModificationException;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Random;
import java.util.stream.Collectors;
import org.hamcrest.Matchers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.sn.wordtrie.testutils.TestBase;

/**
 * Test the trie classes.
 *
 * <p>Achieves code coverage in the following classes:
 * - Trie.java
 * - TrieIterationHelper.java
 * - SimpleTrie.java
 */
public class SimpleTrieTest extends TestBase {
    private SimpleTrie<String, Character, Integer> trie;

    @BeforeEach
    void createTrie() {
        trie = SimpleTrie.forStrings();
        assertNull(trie.put("cat", 0));
        assertNull(trie.put("cats", 1));
        assertNull(trie.put("catacomb", 2));
        assertNull(trie.put("apple", 3));
    }

    @Test
    void testBasic() {
        assertEquals(4, trie.size());
        assertFalse(trie.isEmpty());

        assertEquals(0, trie.get("cat"));
        assertEquals(1, trie.get("cats"));
        assertEquals(2, trie.get("catacomb"));
        assertEquals(3, trie.get("apple"));

        assertTrue(trie.containsKey("apple"));
        assertFalse(trie.containsKey("app"));
        assertFalse(trie.containsKey("yolo"));
        assertFalse(trie.containsKey("catacombs"));

        assertException(() -> trie.get("yolo"), KeyNotFoundException.class, "key not found: yolo");
        assertException(() -> trie.get("ca"), KeyNotFoundException.class);
        assertException(() -> trie.get("catacombs"), NoSuchElementException.class);
        assertEquals(-1, trie.getOrDefault("ca", -1));
        assertEquals(2, trie.getOrDefault("catacomb", -1));

        assertException(() -> trie.put("nullNotAllowed", null), NullPointerException.class);
        assertException(() -> trie.put(null, 9), NullPointerException.class);
        assertEquals(4, trie.size());
        assertFalse(trie.containsKey("nullNotAllowed"));
    }

    @Test
    void testIterationOrder() {
        assertEquals(List.of("cat", "cats", "catacomb", "apple"), toList(trie));
        assertEquals(List.of("cat", "cats", "catacomb", "apple"), toList(trie.keys()));
        assertEquals(List.of(0, 1, 2, 3), toList(trie.values()));
        assertEquals("{cat=0, cats=1, catacomb=2, apple=3}", trie.toString());

        var entries = toList(trie.entries());
        assertEquals(List.of('c', 'a', 't', 's'), entries.get(1).getSymbols());
        assertEquals(Map.entry("cats", 1), entries.get(1));

        Map<String, Integer> copy = trie.stream().collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue));
        assertEquals(Map.of("cat", 0, "cats", 1, "catacomb", 2, "apple", 3), copy);

        var iter = trie.trieIterator();
        toList(iter);
        assertException(iter::next, NoSuchElementException.class);
    }

    @Test
    void testOverwriteDoesNotChangeCounts() {
        assertEquals(0, trie.put("cat", 5));
        assertEquals(5, trie.get("cat"));
        assertEquals(4, trie.size());
        assertEquals(3, trie.countWithPrefix("c"));
        assertEquals(3, trie.countWithPrefix("cat"));

        assertEquals(5, trie.put("cat", 5));
        assertEquals(4, trie.size());
        assertEquals(3, trie.countWithPrefix("cat"));
    }

    @Test
    void testCountWithPrefix() {
        assertEquals(4, trie.countWithPrefix(""));
        assertEquals(3, trie.countWithPrefix("c"));
        assertEquals(3, trie.countWithPrefix("cat"));
        assertEquals(1, trie.countWithPrefix("cata"));
        assertEquals(1, trie.countWithPrefix("cats"));
        assertEquals(1, trie.countWithPrefix("a"));
        assertEquals(0, trie.countWithPrefix("b"));
        assertEquals(0, trie.countWithPrefix("catacombs"));
    }

    @Test
    void testPrefixesOf() {
        var prefixes = toList(trie.prefixesOf("catacombs"));
        assertEquals(List.of(Map.entry("cat", 0), Map.entry("catacomb", 2)), prefixes);
        assertEquals(List.of('c', 'a', 't'), prefixes.get(0).getSymbols());

        assertEquals(List.of(Map.entry("cat", 0)), toList(trie.prefixesOf("catapult")));
        assertEquals(List.of(Map.entry("cat", 0), Map.entry("cats", 1)), toList(trie.prefixesOf("cats")));
        assertEquals(List.of(), toList(trie.prefixesOf("dog")));
        assertEquals(List.of(), toList(trie.prefixesOf("")));

        assertFalse(SimpleTrie.<Integer>forStrings().prefixesOf("catacombs").hasNext());
    }

    @Test
    void testPrefixesOfIsLazy() {
        Iterator<Trie.TrieEntry<String, Character, Integer>> iter = trie.prefixesOf("catacombs");
        assertTrue(iter.hasNext());
        assertEquals("cat", iter.next().getKey());
        trie.put("dog", 4);
        assertException(iter::hasNext, ConcurrentModificationException.class);
    }

    @Test
    void testFindPrefix() {
        assertEquals(List.of("apple"), trie.findPrefix("app"));
        assertEquals(List.of("cat", "cats", "catacomb"), trie.findPrefix("ca"));
        assertEquals(List.of("cat", "cats", "catacomb"), trie.findPrefix("cat"));
        assertEquals(List.of("catacomb"), trie.findPrefix("cata"));
        assertEquals(List.of("apple"), trie.findPrefix("apple"));
        assertEquals(List.of("cat", "cats", "catacomb", "apple"), trie.findPrefix(""));
        assertNull(trie.findPrefix("zzz"));
        assertNull(trie.findPrefix("apples"));
    }

    @Test
    void testRemove() {
        assertEquals(3, trie.remove("apple"));
        assertEquals(3, trie.size());
        assertFalse(trie.containsKey("apple"));
        assertNull(trie.findPrefix("a")); // the whole a-p-p-l-e chain is pruned
        assertEquals(0, trie.countWithPrefix("a"));
        assertException(() -> trie.remove("apple"), KeyNotFoundException.class);

        assertEquals(2, trie.remove("catacomb"));
        assertEquals(2, trie.size());
        assertNull(trie.findPrefix("cata"));
        assertEquals(List.of("cat", "cats"), trie.findPrefix("cat"));

        assertException(() -> trie.remove("dog"), KeyNotFoundException.class);
        assertException(() -> trie.remove("catsup"), KeyNotFoundException.class);
        assertEquals(2, trie.size());
    }

    @Test
    void testRemoveKeyWithChildren() {
        assertEquals(0, trie.remove("cat"));
        assertEquals(3, trie.size());
        assertFalse(trie.containsKey("cat"));
        assertTrue(trie.containsKey("cats"));
        assertTrue(trie.containsKey("catacomb"));
        assertEquals(2, trie.countWithPrefix("cat"));
        assertEquals(List.of("cats", "catacomb"), trie.findPrefix("cat"));

        // "cat" is now only a prefix: removing it again does nothing
        assertNull(trie.remove("cat"));
        assertNull(trie.remove("ca"));
        assertEquals(3, trie.size());
    }

    @Test
    void testEmptyKey() {
        assertNull(trie.put("", 9));
        assertEquals(5, trie.size());
        assertEquals(9, trie.get(""));
        assertEquals("", toList(trie).get(0));
        assertEquals(List.of(Map.entry("", 9), Map.entry("cat", 0)), toList(trie.prefixesOf("cat")));

        assertEquals(9, trie.remove(""));
        assertEquals(4, trie.size());
        assertFalse(trie.containsKey(""));
        assertEquals(List.of("cat", "cats", "catacomb", "apple"), trie.findPrefix(""));
    }

    @Test
    void testClear() {
        trie.put("", 9);
        trie.clear();
        assertEquals(0, trie.size());
        assertTrue(trie.isEmpty());
        assertEquals(List.of(), toList(trie));
        assertEquals(List.of(), trie.findPrefix(""));
        assertNull(trie.findPrefix("c"));
        assertFalse(trie.containsKey(""));

        trie.put("cat", 7);
        assertEquals(1, trie.size());
        assertEquals(List.of("cat"), toList(trie));
    }

    @Test
    void testConcurrentModification() {
        var iter = trie.trieIterator();
        iter.next();
        trie.put("cat", 10); // overwrite is not a structural modification
        assertEquals(Map.entry("cats", 1), iter.next());

        trie.put("dog", 4);
        assertException(iter::hasNext, ConcurrentModificationException.class);
        assertException(iter::next, ConcurrentModificationException.class);

        var iter2 = trie.trieIterator();
        trie.remove("dog");
        assertException(iter2::next, ConcurrentModificationException.class);

        var iter3 = trie.iterator();
        trie.clear();
        assertException(iter3::next, ConcurrentModificationException.class);
    }

    @Test
    void testEntrySetValue() {
        for (var entry : trie.entries()) {
            entry.setValue(entry.getValue() * 10);
        }
        assertEquals(List.of(0, 10, 20, 30), toList(trie.values()));
        assertEquals(4, trie.size());

        var first = trie.trieIterator().next();
        assertException(() -> first.setValue(null), NullPointerException.class);
        trie.remove("cat");
        assertException(() -> first.setValue(1), IllegalStateException.class);
        assertFalse(trie.containsKey("cat"));
        assertEquals(3, trie.size());

        var cats = trie.trieIterator().next();
        assertEquals("cats", cats.getKey());
        trie.clear();
        assertException(() -> cats.setValue(5), IllegalStateException.class);
        assertTrue(trie.isEmpty());
        trie.put("cats", 7);
        assertException(() -> cats.setValue(5), IllegalStateException.class);
        assertEquals(7, trie.get("cats"));
    }

    @Test
    void testInitialMap() {
        Map<String, Integer> initial = new LinkedHashMap<>();
        initial.put("bottle", 1);
        initial.put("bottom", 2);
        initial.put("bottleneck", 3);
        var other = new SimpleTrie<>(KeySequences.characters(), initial);
        assertEquals(3, other.size());
        assertEquals(List.of("bottle", "bottleneck", "bottom"), toList(other));
        assertEquals(List.of(Map.entry("bottle", 1), Map.entry("bottleneck", 3)), toList(other.prefixesOf("bottlenecks")));
    }

    @Test
    void testListKeys() {
        SimpleTrie<List<String>, String, Integer> places = SimpleTrie.forLists();
        places.put(List.of("new", "york"), 1);
        places.put(List.of("new", "york", "city"), 2);
        places.put(List.of("new", "jersey"), 3);
        places.put(List.of("york"), 4);

        assertEquals(4, places.size());
        assertEquals(2, places.get(List.of("new", "york", "city")));
        assertFalse(places.containsKey(List.of("new")));
        assertEquals(List.of(List.of("new", "york"), List.of("new", "york", "city"), List.of("new", "jersey")),
                     places.findPrefix(List.of("new")));
        assertEquals(List.of(List.of("new", "york"), List.of("new", "york", "city")),
                     toList(places.prefixesOf(List.of("new", "york", "city", "hall"))).stream().map(Map.Entry::getKey).toList());

        List<String> key = toList(places).get(0);
        assertException(() -> key.add("hall"), UnsupportedOperationException.class);
    }

    @Test
    void testCodePointKeys() {
        SimpleTrie<String, Integer, String> emoji = new SimpleTrie<>(KeySequences.codePoints());
        emoji.put("😀", "grinning");
        emoji.put("😀😀", "two");
        assertEquals(List.of("😀", "😀😀"), toList(emoji));
        assertEquals(List.of(0x1F600, 0x1F600), toList(emoji.entries()).get(1).getSymbols());
        assertEquals(2, emoji.countWithPrefix("😀"));
    }

    /**
     * Apply random puts and removes on a trie and a HashMap and verify that they agree,
     * including that prefix nodes with no keys below them are pruned.
     */
    @ParameterizedTest
    @ValueSource(longs = {1, 2, 3, 42})
    void testRandomOperations(long seed) {
        Random random = new Random(seed);
        SimpleTrie<String, Character, Integer> randomTrie = SimpleTrie.forStrings();
        Map<String, Integer> expected = new HashMap<>();

        for (int i = 0; i < 2000; i++) {
            String key = randomWord(random);
            if (random.nextInt(3) > 0) {
                Integer value = random.nextInt(5);
                assertEquals(expected.put(key, value), randomTrie.put(key, value));
            } else if (expected.containsKey(key)) {
                assertEquals(expected.remove(key), randomTrie.remove(key));
            } else if (key.isEmpty() || expected.keySet().stream().anyMatch(word -> word.startsWith(key))) {
                assertNull(randomTrie.remove(key));
            } else {
                assertException(() -> randomTrie.remove(key), KeyNotFoundException.class);
            }

            assertEquals(expected.size(), randomTrie.size());
            String probe = randomWord(random);
            assertEquals(expected.containsKey(probe), randomTrie.containsKey(probe));
            long withPrefix = expected.keySet().stream().filter(word -> word.startsWith(probe)).count();
            assertEquals(withPrefix, randomTrie.countWithPrefix(probe));
            if (withPrefix == 0 && !probe.isEmpty()) {
                assertNull(randomTrie.findPrefix(probe));
            }
        }

        assertThat(toList(randomTrie), Matchers.containsInAnyOrder(expected.keySet().toArray()));
    }

    private static String randomWord(Random random) {
        int length = random.nextInt(5);
        StringBuilder word = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            word.append((char) ('a' + random.nextInt(3)));
        }
        return word.toString();
    }
}
