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

import io.bytesearch.util.AsciiCaseUtil;

import java.util.Arrays;

import static io.bytesearch.util.internal.EmptyArrays.EMPTY_INTS;
import static io.bytesearch.util.internal.ObjectUtil.checkNotNull;

/**
 * Implements the
 * <a href="https://en.wikipedia.org/wiki/Boyer%E2%80%93Moore_string-search_algorithm">Boyer-Moore</a>
 * string search algorithm.
 * Use static {@link AbstractByteSearcher#newBoyerMooreSearcher} to create an instance of this searcher.
 * @see AbstractByteSearcher
 */
public class BoyerMooreSearcher extends AbstractByteSearcher {

    static final int ALPHABET_SIZE = 256;

    private static final int INITIAL_CAPACITY = 8;

    private final byte[] needle;
    private final boolean ignoreCase;
    private final int[] badCharTable;
    private final int[] goodSuffixTable;

    BoyerMooreSearcher(byte[] needle, boolean ignoreCase) {
        checkNotNull(needle, "needle");
        this.ignoreCase = ignoreCase;
        this.needle = ignoreCase ? AsciiCaseUtil.toLowerCase(needle) : needle.clone();

        if (this.needle.length == 0) {
            badCharTable = EMPTY_INTS;
            goodSuffixTable = EMPTY_INTS;
        } else {
            badCharTable = buildBadCharTable(this.needle);
            goodSuffixTable = buildGoodSuffixTable(this.needle);
        }
    }

    /**
     * Maps every byte value to the index of its last occurrence in the needle, or {@code -1}.
     */
    private static int[] buildBadCharTable(byte[] needle) {
        final int[] table = new int[ALPHABET_SIZE];
        Arrays.fill(table, -1);
        for (int i = 0; i < needle.length; i++) {
            table[needle[i] & 0xff] = i;
        }
        return table;
    }

    /**
     * Builds the strong good suffix shifts, indexed by the position of the mismatch.
     */
    private static int[] buildGoodSuffixTable(byte[] needle) {
        final int m = needle.length;

        // suffix[i] is the length of the longest substring ending at i which is also a suffix of the needle.
        final int[] suffix = new int[m];
        suffix[m - 1] = m;
        int g = m - 1;
        int f = m - 1;
        for (int i = m - 2; i >= 0; i--) {
            if (i > g && suffix[i + m - 1 - f] < i - g) {
                suffix[i] = suffix[i + m - 1 - f];
            } else {
                g = i;
                f = i;
                while (g >= 0 && needle[g] == needle[g + m - 1 - f]) {
                    g--;
                }
                suffix[i] = f - g;
            }
        }

        final int[] table = new int[m];
        Arrays.fill(table, m);

        // The matched suffix does not occur elsewhere, align the longest prefix that is also a suffix.
        int j = 0;
        for (int i = m - 1; i >= 0; i--) {
            if (suffix[i] == i + 1) {
                for (; j < m - 1 - i; j++) {
                    if (table[j] == m) {
                        table[j] = m - 1 - i;
                    }
                }
            }
        }

        // The matched suffix occurs elsewhere in the needle, align its rightmost other occurrence.
        for (int i = 0; i <= m - 2; i++) {
            table[m - 1 - suffix[i]] = m - 1 - i;
        }
        return table;
    }

    @Override
    public int[] findAll(byte[] haystack) {
        return search(haystack, Integer.MAX_VALUE);
    }

    @Override
    public int findFirst(byte[] haystack) {
        final int[] found = search(haystack, 1);
        return found.length == 0 ? -1 : found[0];
    }

    private int[] search(byte[] haystack, int limit) {
        checkNotNull(haystack, "haystack");
        final int m = needle.length;
        final int n = haystack.length;
        if (m == 0 || n == 0 || m > n) {
            return EMPTY_INTS;
        }

        int[] found = new int[Math.min(limit, INITIAL_CAPACITY)];
        int count = 0;
        int s = 0;
        while (s <= n - m) {
            int j = m - 1;
            while (j >= 0 && needle[j] == normalize(haystack[s + j])) {
                j--;
            }

            if (j < 0) {
                if (count == found.length) {
                    found = Arrays.copyOf(found, count << 1);
                }
                found[count++] = s;
                if (count == limit) {
                    break;
                }
                // Only the bad character rule is applied after a full match.
                s += s + m < n ? m - badCharTable[normalize(haystack[s + m]) & 0xff] : 1;
            } else {
                final int badCharShift = Math.max(1, j - badCharTable[normalize(haystack[s + j]) & 0xff]);
                s += Math.max(badCharShift, goodSuffixTable[j]);
            }
        }
        return count == found.length ? found : Arrays.copyOf(found, count);
    }

    private byte normalize(byte value) {
        return ignoreCase ? AsciiCaseUtil.toLowerCase(value) : value;
    }

    @Override
    public byte[] needle() {
        return needle.clone();
    }

    @Override
    public boolean isIgnoreCase() {
        return ignoreCase;
    }

    int[] badCharTable() {
        return badCharTable.clone();
    }

    int[] goodSuffixTable() {
        return goodSuffixTable.clone();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(needleLength: " + needle.length + ", ignoreCase: " + ignoreCase + ')';
    }
}
