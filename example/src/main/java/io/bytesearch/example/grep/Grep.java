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
package io.bytesearch.example.grep;

import io.bytesearch.search.AbstractByteSearcher;
import io.bytesearch.search.AbstractMultiByteSearcher;
import io.bytesearch.search.ByteSearcher;
import io.bytesearch.search.MultiByteSearcher;
import io.bytesearch.search.SearchMatch;
import io.bytesearch.util.CharsetUtil;
import io.bytesearch.util.internal.SystemPropertyUtil;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;

/**
 * Prints the offsets of every occurrence of one or more needles in a file (or the standard input).
 * <p>
 * A single needle is searched with Boyer-Moore and printed as one offset per line; several comma-separated
 * needles are searched with Aho-Corasick and printed as {@code needle@start-end}.
 * <pre>
 * mvn -pl example exec:java -Dneedles=he,she,his,hers -DignoreCase=true -Dfile=README.md
 * </pre>
 */
public final class Grep {

    static final String NEEDLES = SystemPropertyUtil.get("needles", "");
    static final boolean IGNORE_CASE = SystemPropertyUtil.getBoolean("ignoreCase", false);
    static final String FILE = SystemPropertyUtil.get("file");

    public static void main(String[] args) throws IOException {
        if (NEEDLES.isEmpty()) {
            System.err.println("Usage: -Dneedles=<needle>[,<needle>...] [-DignoreCase=true] [-Dfile=<path>]");
            return;
        }

        final byte[] haystack = FILE == null ? System.in.readAllBytes() : Files.readAllBytes(Paths.get(FILE));
        final String[] needles = NEEDLES.split(",");

        final int count;
        if (needles.length == 1) {
            ByteSearcher searcher = AbstractByteSearcher.newBoyerMooreSearcher(needles[0], IGNORE_CASE);
            int[] offsets = searcher.findAll(haystack);
            for (int offset : offsets) {
                System.out.println(offset);
            }
            count = offsets.length;
        } else {
            MultiByteSearcher searcher = AbstractMultiByteSearcher.newAhoCorasickSearcher(IGNORE_CASE, needles);
            List<SearchMatch> matches = searcher.findAll(haystack);
            for (SearchMatch match : matches) {
                System.out.println(new String(searcher.needle(match.needleIndex()), CharsetUtil.UTF_8) +
                        '@' + match.start() + '-' + match.end());
            }
            count = matches.size();
        }
        System.err.println(count + " match(es)");
    }

    private Grep() {
    }
}
