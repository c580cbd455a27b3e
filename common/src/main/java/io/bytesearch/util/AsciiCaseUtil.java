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
package io.bytesearch.util;

import static io.bytesearch.util.internal.ObjectUtil.checkNotNull;

/**
 * ASCII-only case folding over raw bytes. Only {@code 'A'..'Z'} are folded; every other byte value,
 * including the upper half of the byte range, is left untouched.
 */
public final class AsciiCaseUtil {

    private static final int CASE_DIFF = 'a' - 'A';

    private AsciiCaseUtil() { }

    public static boolean isUpperCase(byte value) {
        return value >= 'A' && value <= 'Z';
    }

    public static byte toLowerCase(byte b) {
        return isUpperCase(b) ? (byte) (b + CASE_DIFF) : b;
    }

    /**
     * Returns a copy of {@code src} with every ASCII upper case letter replaced by its lower case
     * counterpart.
     */
    public static byte[] toLowerCase(byte[] src) {
        checkNotNull(src, "src");
        final byte[] dst = new byte[src.length];
        for (int i = 0; i < src.length; ++i) {
            dst[i] = toLowerCase(src[i]);
        }
        return dst;
    }
}
