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

import io.bytesearch.util.CharsetUtil;

import static io.bytesearch.util.internal.ObjectUtil.checkNotNull;

/**
 * Base class for precomputed {@link ByteSearcher}s.
 * <br>
 * A concrete instance of {@link AbstractByteSearcher} is built for searching for a concrete sequence of bytes
 * (the {@code needle}), it contains precomputed data needed to perform the search, and is meant to be reused
 * whenever searching for the same {@code needle}. Unlike a stateful byte-by-byte processor, a searcher keeps no
 * state between calls, so the same instance can be used for any number of {@code haystacks}, from any number of
 * threads.
 * <br>
 * Example (given that the {@code haystack} is "ZZZABCZZZABC" and the {@code needle} is "abc"):
 * <pre>
 *     ByteSearcher searcher = AbstractByteSearcher.newBoyerMooreSearcher("abc", true);
 *
 *     int[] all = searcher.findAll(haystack);
 *     // all is [3, 9] (indices of the first byte of every occurrence)
 *
 *     int first = searcher.findFirst(haystack);
 *     // first is 3
 *
 *     int count = searcher.count(haystack);
 *     // count is 2
 * </pre>
 */
public abstract class AbstractByteSearcher implements ByteSearcher {

    /**
     * Creates a case-sensitive {@link ByteSearcher} based on the
     * <a href="https://en.wikipedia.org/wiki/Boyer%E2%80%93Moore_string-search_algorithm">Boyer-Moore</a>
     * string search algorithm.
     *
     * @see #newBoyerMooreSearcher(byte[], boolean)
     */
    public static BoyerMooreSearcher newBoyerMooreSearcher(byte[] needle) {
        return newBoyerMooreSearcher(needle, false);
    }

    /**
     * Creates a {@link ByteSearcher} based on the
     * <a href="https://en.wikipedia.org/wiki/Boyer%E2%80%93Moore_string-search_algorithm">Boyer-Moore</a>
     * string search algorithm. The {@code haystack} is compared right to left inside a window which skips ahead
     * using a bad character table and a good suffix table, so large parts of the {@code haystack} are usually never
     * looked at.
     * <br>
     * Precomputation (this method) time is linear in the size of input ({@code O(|needle|)}).
     * <br>
     * The searcher allocates and retains an int array of size 256, an int array of size {@code needle.length} and a
     * copy of the {@code needle}.
     * <br>
     * Search time is sub-linear on average and {@code O(|needle| * |haystack|)} in the worst case.
     * <br>
     * <b>Note:</b> after a full match the window is moved by the bad character rule applied to the byte right after
     * the match (or by one byte at the end of the {@code haystack}), which keeps overlapping occurrences
     * (eg. "AA" is found at 0, 1 and 2 in "AAAA").
     *
     * @param needle an array of bytes to search for, an empty array creates a searcher which never matches
     * @param ignoreCase {@code true} to compare ASCII letters case-insensitively
     * @return a new instance of {@link BoyerMooreSearcher} precomputed for the given {@code needle}
     */
    public static BoyerMooreSearcher newBoyerMooreSearcher(byte[] needle, boolean ignoreCase) {
        return new BoyerMooreSearcher(needle, ignoreCase);
    }

    /**
     * Creates a {@link ByteSearcher} for the UTF-8 encoding of {@code needle}.
     *
     * @see #newBoyerMooreSearcher(byte[], boolean)
     */
    public static BoyerMooreSearcher newBoyerMooreSearcher(CharSequence needle, boolean ignoreCase) {
        return new BoyerMooreSearcher(bytes(needle, "needle"), ignoreCase);
    }

    @Override
    public int[] findAll(CharSequence haystack) {
        return findAll(bytes(haystack, "haystack"));
    }

    @Override
    public int findFirst(CharSequence haystack) {
        return findFirst(bytes(haystack, "haystack"));
    }

    @Override
    public boolean contains(byte[] haystack) {
        return findFirst(haystack) != -1;
    }

    @Override
    public boolean contains(CharSequence haystack) {
        return contains(bytes(haystack, "haystack"));
    }

    @Override
    public int count(byte[] haystack) {
        return findAll(haystack).length;
    }

    @Override
    public int count(CharSequence haystack) {
        return count(bytes(haystack, "haystack"));
    }

    static byte[] bytes(CharSequence seq, String name) {
        return checkNotNull(seq, name).toString().getBytes(CharsetUtil.UTF_8);
    }
}
