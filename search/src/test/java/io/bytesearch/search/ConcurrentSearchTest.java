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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Shares one searcher of each kind between several threads scanning different haystacks.
 */
public class ConcurrentSearchTest {

    private static final int THREADS = 8;
    private static final int ROUNDS = 200;

    @Test
    @Timeout(value = 30, unit = TimeUnit.SECONDS)
    public void testSharedSearchers() throws Exception {
        final ByteSearcher single = AbstractByteSearcher.newBoyerMooreSearcher("needle", true);
        final MultiByteSearcher multi = AbstractMultiByteSearcher.newAhoCorasickSearcher(true, "needle", "hay");

        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        try {
            List<Future<?>> futures = new ArrayList<Future<?>>();
            for (int t = 0; t < THREADS; t++) {
                final int copies = t + 1;
                futures.add(executor.submit(new Callable<Void>() {
                    @Override
                    public Void call() {
                        StringBuilder haystack = new StringBuilder();
                        int[] expected = new int[copies];
                        for (int i = 0; i < copies; i++) {
                            haystack.append("hay");
                            expected[i] = haystack.length();
                            haystack.append("NEEDLE");
                        }
                        for (int round = 0; round < ROUNDS; round++) {
                            assertArrayEquals(expected, single.findAll(haystack));
                            List<SearchMatch> matches = multi.findAll(haystack);
                            assertEquals(2 * copies, matches.size());
                            for (int i = 0; i < copies; i++) {
                                assertEquals(new SearchMatch(1, expected[i] - 3, expected[i] - 1),
                                        matches.get(2 * i));
                                assertEquals(new SearchMatch(0, expected[i], expected[i] + 5),
                                        matches.get(2 * i + 1));
                            }
                        }
                        return null;
                    }
                }));
            }
            for (Future<?> future : futures) {
                // rethrows assertion failures from the worker threads
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
