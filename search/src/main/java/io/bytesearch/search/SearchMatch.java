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

/**
 * An occurrence of one of the {@code needles} of a {@link MultiByteSearcher} inside a {@code haystack}.
 * Both {@link #start()} and {@link #end()} are inclusive byte offsets into the {@code haystack} as it was given.
 */
public final class SearchMatch {

    private final int needleIndex;
    private final int start;
    private final int end;

    public SearchMatch(int needleIndex, int start, int end) {
        this.needleIndex = needleIndex;
        this.start = start;
        this.end = end;
    }

    /**
     * Returns the index of the found needle in the array (or list) the searcher was created with.
     */
    public int needleIndex() {
        return needleIndex;
    }

    /**
     * Returns the offset of the first byte of the occurrence.
     */
    public int start() {
        return start;
    }

    /**
     * Returns the offset of the last byte of the occurrence.
     */
    public int end() {
        return end;
    }

    public int length() {
        return end - start + 1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SearchMatch)) {
            return false;
        }
        SearchMatch that = (SearchMatch) o;
        return needleIndex == that.needleIndex && start == that.start && end == that.end;
    }

    @Override
    public int hashCode() {
        int hash = needleIndex;
        hash = 31 * hash + start;
        hash = 31 * hash + end;
        return hash;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(needleIndex: " + needleIndex + ", start: " + start + ", end: " + end + ')';
    }
}
