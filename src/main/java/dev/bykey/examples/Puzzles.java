package dev.bykey.examples;

import dev.bykey.ByKey;
import dev.bykey.model.Extrema;
import dev.bykey.model.KeyValue;
import dev.bykey.ranking.Ranking;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Classic array and string puzzles solved with by-key operations.
 *
 * <p>Each method is a small, complete caller of {@link ByKey} or
 * {@link Ranking}; together they show how the operations combine.
 */
public final class Puzzles {

    private Puzzles() {
    }

    /**
     * Returns the letters of {@code word} in sorted order. Two words are
     * anagrams exactly when their signatures are equal.
     */
    public static String anagramSignature(String word) {
        char[] letters = word.toCharArray();
        Arrays.sort(letters);
        return new String(letters);
    }

    /**
     * Groups words that are anagrams of each other. Each group keeps the
     * input order of its words; the order of the groups is unspecified.
     */
    public static List<List<String>> groupAnagrams(List<String> words) {
        Map<String, List<String>> groups = ByKey.groupBy(words, Puzzles::anagramSignature, Function.identity());
        return new ArrayList<>(groups.values());
    }

    /**
     * Returns true when {@code t} is a permutation of the characters of {@code s}.
     */
    public static boolean isAnagram(String s, String t) {
        return ByKey.countBy(characters(s), c -> c).equals(ByKey.countBy(characters(t), c -> c));
    }

    /**
     * Returns the {@code k} most frequent numbers, most frequent first; equal
     * frequencies go to the smaller number.
     */
    public static List<Integer> topKFrequent(List<Integer> numbers, int k) {
        Map<Integer, Long> freq = ByKey.countBy(numbers, x -> x);
        return Ranking.topKByValue(freq, k).stream()
                .map(KeyValue::key)
                .collect(Collectors.toList());
    }

    /**
     * Returns the elements common to both lists, with multiplicity, in the
     * order they appear in {@code second}.
     */
    public static List<Integer> intersect(List<Integer> first, List<Integer> second) {
        Map<Integer, Long> remaining = ByKey.countBy(first, x -> x);
        List<Integer> out = new ArrayList<>(Math.min(first.size(), second.size()));
        for (Integer x : second) {
            Long left = remaining.get(x);
            if (left != null && left > 0) {
                out.add(x);
                remaining.put(x, left - 1);
            }
        }
        return out;
    }

    /**
     * Returns the length of the shortest contiguous run of {@code numbers}
     * that has the same degree (highest frequency of any value) as the whole
     * list.
     */
    public static int degreeOfArray(List<Integer> numbers) {
        if (numbers.isEmpty()) {
            return 0;
        }
        Map<Integer, Long> freq = ByKey.countBy(numbers, x -> x);
        int[] position = {0};
        Map<Integer, Extrema<Integer>> spans = ByKey.minMaxBy(numbers, x -> x, x -> position[0]++);

        long degree = 0;
        for (long count : freq.values()) {
            degree = Math.max(degree, count);
        }

        int best = numbers.size();
        for (Map.Entry<Integer, Long> entry : freq.entrySet()) {
            if (entry.getValue() == degree) {
                Extrema<Integer> span = ByKey.at(spans, entry.getKey());
                best = Math.min(best, span.max() - span.min() + 1);
            }
        }
        return best;
    }

    /**
     * Replaces every number by its 1-based rank among the distinct values.
     */
    public static List<Integer> rankTransform(List<Integer> numbers) {
        Collection<Integer> distinctSorted = new TreeSet<>(numbers);
        int[] next = {1};
        Map<Integer, Integer> rank = ByKey.indexBy(distinctSorted, x -> x, x -> next[0]++);

        List<Integer> out = new ArrayList<>(numbers.size());
        for (Integer x : numbers) {
            out.add(ByKey.at(rank, x));
        }
        return out;
    }

    private static List<Character> characters(String s) {
        List<Character> chars = new ArrayList<>(s.length());
        for (int i = 0; i < s.length(); i++) {
            chars.add(s.charAt(i));
        }
        return chars;
    }
}
