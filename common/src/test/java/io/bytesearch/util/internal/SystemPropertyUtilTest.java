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
package io.bytesearch.util.internal;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SystemPropertyUtilTest {

    private static final String KEY = "io.bytesearch.test.property";

    @AfterEach
    public void clearProperty() {
        System.clearProperty(KEY);
    }

    @Test
    public void testGetWithKeyNull() {
        assertThrows(NullPointerException.class, new Executable() {
            @Override
            public void execute() {
                SystemPropertyUtil.get(null, null);
            }
        });
    }

    @Test
    public void testGetWithKeyEmpty() {
        assertThrows(IllegalArgumentException.class, new Executable() {
            @Override
            public void execute() {
                SystemPropertyUtil.get("", null);
            }
        });
    }

    @Test
    public void testGetMissingProperty() {
        assertNull(SystemPropertyUtil.get(KEY));
        assertEquals("default", SystemPropertyUtil.get(KEY, "default"));
    }

    @Test
    public void testGetPropertyValue() {
        System.setProperty(KEY, "value");
        assertEquals("value", SystemPropertyUtil.get(KEY));
        assertEquals("value", SystemPropertyUtil.get(KEY, "default"));
    }

    @Test
    public void testGetBooleanDefaultValue() {
        assertTrue(SystemPropertyUtil.getBoolean(KEY, true));
        assertFalse(SystemPropertyUtil.getBoolean(KEY, false));

        System.setProperty(KEY, "  ");
        assertTrue(SystemPropertyUtil.getBoolean(KEY, true));
        assertFalse(SystemPropertyUtil.getBoolean(KEY, false));
    }

    @Test
    public void testGetBooleanWithTrueValue() {
        for (String value : new String[] { "true", "TRUE", " yes ", "1" }) {
            System.setProperty(KEY, value);
            assertTrue(SystemPropertyUtil.getBoolean(KEY, false), value);
        }
    }

    @Test
    public void testGetBooleanWithFalseValue() {
        for (String value : new String[] { "false", "No", "0" }) {
            System.setProperty(KEY, value);
            assertFalse(SystemPropertyUtil.getBoolean(KEY, true), value);
        }
    }

    @Test
    public void testGetBooleanWithWrongValue() {
        System.setProperty(KEY, "abc");
        assertTrue(SystemPropertyUtil.getBoolean(KEY, true));
        System.setProperty(KEY, "123");
        assertFalse(SystemPropertyUtil.getBoolean(KEY, false));
    }

    @Test
    public void testGetInt() {
        assertEquals(65536, SystemPropertyUtil.getInt(KEY, 65536));

        System.setProperty(KEY, " 123 ");
        assertEquals(123, SystemPropertyUtil.getInt(KEY, 1));

        System.setProperty(KEY, "-5");
        assertEquals(-5, SystemPropertyUtil.getInt(KEY, 1));
    }

    @Test
    public void testGetIntWithWrongValue() {
        System.setProperty(KEY, "NotInt");
        assertEquals(1, SystemPropertyUtil.getInt(KEY, 1));

        System.setProperty(KEY, "4294967296");
        assertEquals(1, SystemPropertyUtil.getInt(KEY, 1));
    }
}
