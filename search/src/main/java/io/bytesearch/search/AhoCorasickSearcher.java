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
import io.bytesearch.util.internal.SystemPropertyUtil;
import io.bytesearch.util.internal.logging.InternalLogger;
import io.bytesearch.util.internal.logging.InternalLoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Queue;

import static io.bytesearch.util.internal.EmptyArrays.EMPTY_INTS;
import static io.bytesearch.util.internal.ObjectUtil.checkIndex;
import static io.bytesearch.util.internal.ObjectUtil.checkNotNull;

/**
 * Implements <a href="https://en.wikipedia.org/wiki/Aho%E2%80%93Corasick_algorithm">Aho–Corasick</a>
 * string search algorithm.
 * Use static {@link AbstractMultiByteSearcher#newAhoCorasickSearcher} to create an instance of this searcher.
 * @see AbstractMultiByteSearcher
 */
public class AhoCorasickSearcher extends AbstractMultiByteSearcher {

    private static final InternalLogger logger = InternalLoggerFactory.getInstance(AhoCorasickSearcher.class);

    static final int BITS_PER_SYMBOL = 8;
    static final int ALPHABET_SIZE = 1 << BITS_PER_SYMBOL;

    static final String STATE_WARNING_THRESHOLD_PROPERTY = "io.bytesearch.search.ahoCorasick.stateWarningThreshold";
    private static final int DEFAULT_STATE_WARNING_THRESHOLD = 65536;
    private static final int STATE_WARNING_THRESHOLD;

    private static final int INITIAL_CAPACITY = 16;
    // Largest capacity whose jump table length (capacity << BITS_PER_SYMBOL) is still a positive int.
    static final int MAX_CAPACITY = 1 << (Integer.SIZE - 2 - BITS_PER_SYMBOL);

    static {
        STATE_WARNING_THRESHOLD = SystemPropertyUtil.getInt(STATE_WARNING_THRESHOLD_PROPERTY,
                DEFAULT_STATE_WARNING_THRESHOLD);
        if (logger.isDebugEnabled()) {
            logger.debug("-D{}: {}", STATE_WARNING_THRESHOLD_PROPERTY, STATE_WARNING_THRESHOLD);
        }
    }

    private final byte[][] needles;
    private final boolean ignoreCase;

    // Row offsets: state s owns jumpTable[s << BITS_PER_SYMBOL .. (s << BITS_PER_SYMBOL) + 255] and every
    // transition holds the row offset of its target, so a step is jumpTable[position | value].
    private final int[] jumpTable;
    private final int[] failureLinks;
    private final int[][] outputs;
    private final int stateCount;

    private static final class Context {
        int[] jumpTable;
        int[][] outputs;
        int stateCount;
    }

    AhoCorasickSearcher(byte[][] needles, boolean ignoreCase) {
        this(needles, ignoreCase, STATE_WARNING_THRESHOLD);
    }

    AhoCorasickSearcher(byte[][] needles, boolean ignoreCase, int stateWarningThreshold) {
        this.ignoreCase = ignoreCase;
        this.needles = new byte[needles.length][];
        for (int i = 0; i < needles.length; i++) {
            this.needles[i] = ignoreCase ? AsciiCaseUtil.toLowerCase(needles[i]) : needles[i].clone();
        }

        Context context = buildTrie(this.needles);
        stateCount = context.stateCount;
        jumpTable = context.jumpTable;
        outputs = context.outputs;
        failureLinks = linkSuffixes(jumpTable, outputs, stateCount);

        if (stateWarningThreshold > 0 && stateCount > stateWarningThreshold) {
            logger.warn("Aho-Corasick automaton for {} needles has {} states (threshold: {}), retaining {} bytes; " +
                    "consider splitting the needles or raising -D{}", needles.length, stateCount,
                    stateWarningThreshold, (long) jumpTable.length * Integer.BYTES, STATE_WARNING_THRESHOLD_PROPERTY);
        } else if (logger.isDebugEnabled()) {
            logger.debug("Built Aho-Corasick automaton: {} needles, {} states, ignoreCase: {}",
                    needles.length, stateCount, ignoreCase);
        }
    }

    private static Context buildTrie(byte[][] needles) {
        int capacity = INITIAL_CAPACITY;
        int[] jumpTable = new int[capacity << BITS_PER_SYMBOL];
        int[][] outputs = new int[capacity][];
        outputs[0] = EMPTY_INTS;
        int stateCount = 1;

        for (int needleId = 0; needleId < needles.length; needleId++) {
            int currentPosition = 0;

            for (byte ch0: needles[needleId]) {
                final int next = currentPosition | (ch0 & 0xff);

                // 0 is the root, which is never a child, so it marks a missing edge.
                if (jumpTable[next] == 0) {
                    if (stateCount == capacity) {
                        capacity = growCapacity(capacity);
                        jumpTable = Arrays.copyOf(jumpTable, capacity << BITS_PER_SYMBOL);
                        outputs = Arrays.copyOf(outputs, capacity);
                    }
                    outputs[stateCount] = EMPTY_INTS;
                    jumpTable[next] = stateCount << BITS_PER_SYMBOL;
                    stateCount++;
                }

                currentPosition = jumpTable[next];
            }

            final int state = currentPosition >> BITS_PER_SYMBOL;
            outputs[state] = append(outputs[state], needleId);
        }

        Context context = new Context();
        context.jumpTable = Arrays.copyOf(jumpTable, stateCount << BITS_PER_SYMBOL);
        context.outputs = Arrays.copyOf(outputs, stateCount);
        context.stateCount = stateCount;
        return context;
    }

    static int growCapacity(int capacity) {
        if (capacity >= MAX_CAPACITY) {
            throw new IllegalArgumentException(
                    "needles require more than " + MAX_CAPACITY + " automaton states (expected: total needle " +
                    "length < " + MAX_CAPACITY + ')');
        }
        return capacity << 1;
    }

    /**
     * Resolves the failure link of every state in breadth first order, replaces every missing edge with the
     * transition of the failure state, and closes the outputs of every state over its failure link.
     *
     * @return the failure link (as a state index) of every state
     */
    private static int[] linkSuffixes(int[] jumpTable, int[][] outputs, int stateCount) {
        final int[] suffixLinks = new int[stateCount];
        final Queue<Integer> queue = new ArrayDeque<Integer>();

        // Missing root edges stay 0, which loops back to the root.
        for (int ch = 0; ch < ALPHABET_SIZE; ch++) {
            final int child = jumpTable[ch];
            if (child != 0) {
                final int childState = child >> BITS_PER_SYMBOL;
                suffixLinks[childState] = 0;
                // The root only holds empty needles; its children inherit them like any other failure state.
                outputs[childState] = concat(outputs[childState], outputs[0]);
                queue.add(child);
            }
        }

        while (!queue.isEmpty()) {
            final int v = queue.remove();
            final int u = suffixLinks[v >> BITS_PER_SYMBOL] << BITS_PER_SYMBOL;

            for (int ch = 0; ch < ALPHABET_SIZE; ch++) {
                final int vIndex = v | ch;
                final int jumpV = jumpTable[vIndex];
                final int jumpU = jumpTable[u | ch];

                if (jumpV != 0) {
                    final int childState = jumpV >> BITS_PER_SYMBOL;
                    suffixLinks[childState] = jumpU >> BITS_PER_SYMBOL;
                    outputs[childState] = concat(outputs[childState], outputs[jumpU >> BITS_PER_SYMBOL]);
                    queue.add(jumpV);
                } else {
                    jumpTable[vIndex] = jumpU;
                }
            }
        }
        return suffixLinks;
    }

    private static int[] append(int[] array, int value) {
        final int[] result = Arrays.copyOf(array, array.length + 1);
        result[array.length] = value;
        return result;
    }

    private static int[] concat(int[] head, int[] tail) {
        if (tail.length == 0) {
            return head;
        }
        if (head.length == 0) {
            return tail;
        }
        final int[] result = Arrays.copyOf(head, head.length + tail.length);
        System.arraycopy(tail, 0, result, head.length, tail.length);
        return result;
    }

    @Override
    public List<SearchMatch> findAll(byte[] haystack) {
        return search(haystack, Integer.MAX_VALUE);
    }

    @Override
    public SearchMatch findFirst(byte[] haystack) {
        final List<SearchMatch> found = search(haystack, 1);
        return found.isEmpty() ? null : found.get(0);
    }

    private List<SearchMatch> search(byte[] haystack, int limit) {
        checkNotNull(haystack, "haystack");
        List<SearchMatch> matches = null;
        int currentPosition = 0;

        for (int i = 0; i < haystack.length; i++) {
            final byte value = ignoreCase ? AsciiCaseUtil.toLowerCase(haystack[i]) : haystack[i];
            currentPosition = jumpTable[currentPosition | (value & 0xff)];

            final int[] found = outputs[currentPosition >> BITS_PER_SYMBOL];
            for (int needleId : found) {
                if (matches == null) {
                    matches = new ArrayList<SearchMatch>();
                }
                matches.add(new SearchMatch(needleId, i - needles[needleId].length + 1, i));
                if (matches.size() == limit) {
                    return Collections.unmodifiableList(matches);
                }
            }
        }
        return matches == null ? Collections.<SearchMatch>emptyList() : Collections.unmodifiableList(matches);
    }

    @Override
    public int needleCount() {
        return needles.length;
    }

    @Override
    public byte[] needle(int needleIndex) {
        return needles[checkIndex(needleIndex, needles.length, "needleIndex")].clone();
    }

    @Override
    public boolean isIgnoreCase() {
        return ignoreCase;
    }

    /**
     * Returns the number of states of the automaton, the root included.
     */
    public int stateCount() {
        return stateCount;
    }

    int transition(int state, byte value) {
        return jumpTable[(state << BITS_PER_SYMBOL) | (value & 0xff)] >> BITS_PER_SYMBOL;
    }

    int failureLink(int state) {
        return failureLinks[state];
    }

    int[] outputs(int state) {
        return outputs[state].clone();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(needles: " + needles.length + ", states: " + stateCount +
                ", ignoreCase: " + ignoreCase + ')';
    }
}
