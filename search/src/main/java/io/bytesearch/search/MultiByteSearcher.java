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

/**
 * Searches a {@code haystack} for every occurrence of any of several precomputed {@code needles}, scanning
 * every byte of the {@code haystack} only once regardless of the number of {@code needles}.
 * <br>
 * Occurrences are reported as {@link SearchMatch}es ordered by the offset of their last byte. When several
 * {@code needles} end at the same offset (eg. {@code "she"} and {@code "he"} in {@code "ushers"}), the longer
 * needle comes first and the needles it ends with follow. Overlapping and nested occurrences are all reported.
 * <br>
 * Implementations are immutable and can be used concurrently by several threads.
 */
public interface MultiByteSearcher {

    /**
     * Returns every occurrence of every {@code needle} in the {@code haystack}, in the order they were found.
     * The returned list is unmodifiable.
     */
    List<SearchMatch> findAll(byte[] haystack);

    /**
     * Same as {@link #findAll(byte[])} for the UTF-8 encoding of {@code haystack}.
     */
    List<SearchMatch> findAll(CharSequence haystack);

    /**
     * Returns the first element of {@link #findAll(byte[])}, or {@code null} if there is none.
     */
    SearchMatch findFirst(byte[] haystack);

    /**
     * Returns the first element of {@link #findAll(CharSequence)}, or {@code null} if there is none.
     */
    SearchMatch findFirst(CharSequence haystack);

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
     * Returns the number of {@code needles}, duplicates included.
     */
    int needleCount();

    /**
     * Returns a copy of the {@code needle} with the given index as it is matched, i.e. lower cased if
     * {@link #isIgnoreCase()}.
     */
    byte[] needle(int needleIndex);

    /**
     * Returns {@code true} if ASCII letters are compared case-insensitively.
     */
    boolean isIgnoreCase();
}
