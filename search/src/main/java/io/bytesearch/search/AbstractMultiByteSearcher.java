/*
 * Copyright 2026 The Bytesearch Project
 *
 * The Bytesearch Project licenses this file to you under the Apache License,
 * version 2.0 (the "License"); you may not use this file except in compliance
 * with the License. You may obtain a copy of the License at:
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 * WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 * License for the specific language governing permissions and limitations
 * under the License.
 */
package io.bytesearch.search;

import java.util.List;

import static io.bytesearch.util.internal.ObjectUtil.checkNotNullElements;

/**
 * Base class for precomputed {@link MultiByteSearcher}s.
 * <br>
 * The purpose of {@link MultiByteSearcher} is to perform efficient simultaneous search for multiple {@code needles}
 * in the {@code haystack}, while scanning every byte of the input sequentially, only once. While it can also be used
 * to search for just a single {@code needle}, using a {@link ByteSearcher} would be more efficient for doing that.
 * <br>
 * See the documentation of {@link AbstractByteSearcher} for a description of common usage. In addition to the
 * offsets, every {@link SearchMatch} carries the index of the found {@code needle} in the array of
 * {@code needles}.
 * <br>
 * <b>Note:</b> in some cases one {@code needle} can be a suffix of another {@code needle}, eg. {@code {"BC", "ABC"}},
 * and there can potentially be multiple {@code needles} found ending at the same position of the {@code haystack}.
 * In such case all of them are reported, the longest one first.
 * <br>
 * Usage example (given that the {@code haystack} is "ushers" and the {@code needles} are "he", "she", "his"
 * and "hers"):
 * <pre>
 *      MultiByteSearcher searcher = AbstractMultiByteSearcher.newAhoCorasickSearcher(false,
 *          "he", "she", "his", "hers");
 *
 *      List&lt;SearchMatch&gt; matches = searcher.findAll(haystack);
 *      // matches are:
 *      //   SearchMatch(needleIndex: 1, start: 1, end: 3)   "she"
 *      //   SearchMatch(needleIndex: 0, start: 2, end: 3)   "he"
 *      //   SearchMatch(needleIndex: 3, start: 2, end: 5)   "hers"
 * </pre>
 */
public abstract class AbstractMultiByteSearcher implements MultiByteSearcher {

    /**
     * Creates a {@link MultiByteSearcher} based on
     * <a href="https://en.wikipedia.org/wiki/Aho%E2%80%93Corasick_algorithm">Aho–Corasick</a>
     * string search algorithm.
     * <br>
     * Precomputation (this method) time is linear in the size of input ({@code O(Σ|needles|)}), times the size
     * of the byte alphabet.
     * <br>
     * The searcher allocates and retains an array of 256 * X ints plus the per-state arrays of found needle
     * indices, where X is the sum of lengths of each entry of {@code needles} minus the sum of lengths of repeated
     * prefixes of the {@code needles}.
     * <br>
     * Search time is linear in the size of the {@code haystack} plus the number of reported matches
     * ({@code O(|haystack| + |matches|)}). Every byte of the {@code haystack} is processed only once,
     * sequentially, regardless of the number of {@code needles} being searched for.
     * <br>
     * The automaton holds at most {@code 2^22} states (a jump table of {@code 2^30} ints), so X must stay below
     * that.
     *
     * @param ignoreCase {@code true} to compare ASCII letters case-insensitively
     * @param needles a varargs array of arrays of bytes to search for; duplicates keep their own indices
     * @return a new instance of {@link AhoCorasickSearcher} precomputed for the given {@code needles}
     * @throws IllegalArgumentException if the {@code needles} need more than {@code 2^22} states
     */
    public static AhoCorasickSearcher newAhoCorasickSearcher(boolean ignoreCase, byte[]... needles) {
        checkNotNullElements(needles, "needles");
        return new AhoCorasickSearcher(needles, ignoreCase);
    }

    /**
     * Creates a {@link MultiByteSearcher} for the UTF-8 encodings of {@code needles}.
     *
     * @see #newAhoCorasickSearcher(boolean, byte[]...)
     */
    public static AhoCorasickSearcher newAhoCorasickSearcher(boolean ignoreCase, CharSequence... needles) {
        checkNotNullElements(needles, "needles");
        final byte[][] encoded = new byte[needles.length][];
        for (int i = 0; i < needles.length; i++) {
            encoded[i] = AbstractByteSearcher.bytes(needles[i], "needles");
        }
        return new AhoCorasickSearcher(encoded, ignoreCase);
    }

    /**
     * Creates a {@link MultiByteSearcher} for the given list of {@code needles}.
     *
     * @see #newAhoCorasickSearcher(boolean, byte[]...)
     */
    public static AhoCorasickSearcher newAhoCorasickSearcher(List<byte[]> needles, boolean ignoreCase) {
        checkNotNullElements(needles, "needles");
        return new AhoCorasickSearcher(needles.toArray(new byte[0][]), ignoreCase);
    }

    @Override
    public List<SearchMatch> findAll(CharSequence haystack) {
        return findAll(AbstractByteSearcher.bytes(haystack, "haystack"));
    }

    @Override
    public SearchMatch findFirst(CharSequence haystack) {
        return findFirst(AbstractByteSearcher.bytes(haystack, "haystack"));
    }

    @Override
    public boolean contains(byte[] haystack) {
        return findFirst(haystack) != null;
    }

    @Override
    public boolean contains(CharSequence haystack) {
        return contains(AbstractByteSearcher.bytes(haystack, "haystack"));
    }

    @Override
    public int count(byte[] haystack) {
        return findAll(haystack).size();
    }

    @Override
    public int count(CharSequence haystack) {
        return count(AbstractByteSearcher.bytes(haystack, "haystack"));
    }
}
