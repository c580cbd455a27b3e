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

/**
 * Exact search for byte sequences ({@code needles}) inside byte arrays ({@code haystacks}).
 * <p>
 * {@link io.bytesearch.search.ByteSearcher} looks for a single needle with
 * {@link io.bytesearch.search.BoyerMooreSearcher}, {@link io.bytesearch.search.MultiByteSearcher} looks for many
 * needles in one pass with {@link io.bytesearch.search.AhoCorasickSearcher}. Searchers are precomputed once and
 * are immutable afterwards, so a single instance can be shared by any number of threads.
 */
package io.bytesearch.search;
