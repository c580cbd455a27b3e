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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class AsciiCaseUtilTest {

    @Test
    public void testIsUpperCase() {
        for (int i = Byte.MIN_VALUE; i <= Byte.MAX_VALUE; i++) {
            byte b = (byte) i;
            assertEquals(b >= 'A' && b <= 'Z', AsciiCaseUtil.isUpperCase(b), "byte " + i);
        }
    }

    @Test
    public void testToLowerCaseOnlyFoldsAsciiLetters() {
        for (int i = Byte.MIN_VALUE; i <= Byte.MAX_VALUE; i++) {
            byte b = (byte) i;
            byte expected = b >= 'A' && b <= 'Z' ? (byte) (b + 32) : b;
            assertEquals(expected, AsciiCaseUtil.toLowerCase(b), "byte " + i);
        }
        // Latin-1 upper case letters and UTF-8 lead bytes are left alone
        assertEquals((byte) 0xC9, AsciiCaseUtil.toLowerCase((byte) 0xC9));
        assertEquals('@', AsciiCaseUtil.toLowerCase((byte) '@'));
        assertEquals('[', AsciiCaseUtil.toLowerCase((byte) '['));
    }

    @Test
    public void testToLowerCaseArrayReturnsCopy() {
        byte[] src = "Hello, WORLD É".getBytes(CharsetUtil.UTF_8);
        byte[] copy = src.clone();
        byte[] lower = AsciiCaseUtil.toLowerCase(src);

        assertNotSame(src, lower);
        assertArrayEquals(copy, src);
        assertArrayEquals("hello, world É".getBytes(CharsetUtil.UTF_8), lower);
        assertArrayEquals(new byte[0], AsciiCaseUtil.toLowerCase(new byte[0]));
        assertThrows(NullPointerException.class, () -> AsciiCaseUtil.toLowerCase((byte[]) null));
    }

    @Test
    public void testFoldsOnlyAsciiPairsTogether() {
        assertEquals(AsciiCaseUtil.toLowerCase((byte) 'a'), AsciiCaseUtil.toLowerCase((byte) 'A'));
        assertEquals(AsciiCaseUtil.toLowerCase((byte) 'z'), AsciiCaseUtil.toLowerCase((byte) 'Z'));
        // 0xC9 and 0xE9 differ by 32 like an ASCII pair but are not letters here
        assertNotEquals(AsciiCaseUtil.toLowerCase((byte) 0xC9), AsciiCaseUtil.toLowerCase((byte) 0xE9));
        assertNotEquals(AsciiCaseUtil.toLowerCase((byte) '@'), AsciiCaseUtil.toLowerCase((byte) '`'));
    }
}
