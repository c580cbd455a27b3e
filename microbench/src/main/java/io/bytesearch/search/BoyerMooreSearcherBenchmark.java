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

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Threads;
import org.openjdk.jmh.annotations.Warmup;

import java.util.SplittableRandom;
import java.util.concurrent.TimeUnit;

@Threads(1)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(2)
@Warmup(iterations = 5, time = 1)
@Measurement(iterations = 8, time = 1)
@State(Scope.Benchmark)
public class BoyerMooreSearcherBenchmark {

    private static final byte[] LETTERS =
            "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ".getBytes(CharsetUtil.UTF_8);

    @Param({ "5", "20", "50" })
    int needleLength;

    @Param({ "100", "1000", "2000" })
    int haystackLength;

    @Param({ "false", "true" })
    boolean ignoreCase;

    @Param({ "0" })
    int seed;

    private BoyerMooreSearcher searcher;
    private byte[] haystack;

    @Setup(Level.Trial)
    public void init() {
        final SplittableRandom random = new SplittableRandom(seed);
        searcher = AbstractByteSearcher.newBoyerMooreSearcher(randomLetters(random, needleLength), ignoreCase);
        haystack = randomLetters(random, haystackLength);
    }

    static byte[] randomLetters(SplittableRandom random, int length) {
        final byte[] bytes = new byte[length];
        for (int i = 0; i < length; i++) {
            bytes[i] = LETTERS[random.nextInt(LETTERS.length)];
        }
        return bytes;
    }

    @Benchmark
    public int[] findAll() {
        return searcher.findAll(haystack);
    }

    @Benchmark
    public int findFirst() {
        return searcher.findFirst(haystack);
    }
}
