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
 * Searches a {@code haystack} for every occurrence of a single precomputed {@code needle}.
 * <br>
 * Every index returned by the methods of this interface is the offset of the <b>first</b> byte of an
 * occurrence, counted from the beginning of the {@code haystack} as it was given. {@link CharSequence}
 * haystacks are encoded with UTF-8 before they are searched, so their indices are byte offsets as well.
 * <br>
 * Implementations are immutable and can be used concurrently by several threads.
 */
public interface ByteSearcher {

    /**
     * Returns the start offsets of the occurrences of the {@code needle}, in the order they were found.
     * The result is empty if the {@code needle} is empty, if the {@code haystack} is empty or if
     * the {@code needle} is longer than the {@code haystack}.
     */
    int[] findAll(byte[] haystack);

    /**
     * Same as {@link #findAll(byte[])} for the UTF-8 encoding of {@code haystack}.
     */
    int[] findAll(CharSequence haystack);

    /**
     * Returns the first element of {@link #findAll(byte[])}, or {@code -1} if there is none.
     */
    int findFirst(byte[] haystack);

    /**
     * Returns the first element of {@link #findAll(CharSequence)}, or {@code -1} if there is none.
     */
    int findFirst(CharSequence haystack);

    /**
     * Returns {@code true} if and only if {@link #findAll(byte[])} is not empty.
     */
    boolean contains(byte[] haystack);

    /**
     * Returns {@code true} if and only if {@link #findAll(CharSequence)} is not empty.
     */
    boolean contains(CharSequence haystack);

    /**
     * Returns the number of elements {@link #findAll(byte[])} returns.
     */
    int count(byte[] haystack);

    /**
     * Returns the number of elements {@link #findAll(CharSequence)} returns.
     */
    int count(CharSequence haystack);

    /**
     * Returns a copy of the {@code needle} as it is matched, i.e. lower cased if {@link #isIgnoreCase()}.
     */
    byte[] needle();

    /**
     * Returns {@code true} if ASCII letters are compared case-insensitively.
     */
    boolean isIgnoreCase();
}
