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

import java.util.Collection;

/**
 * A grab-bag of useful utility methods.
 */
public final class ObjectUtil {

    private static final int INT_ZERO = 0;

    private ObjectUtil() {
    }

    /**
     * Checks that the given argument is not null. If it is, throws {@link NullPointerException}.
     * Otherwise, returns the argument.
     */
    public static <T> T checkNotNull(T arg, String text) {
        if (arg == null) {
            throw new NullPointerException(text);
        }
        return arg;
    }

    /**
     * Checks that the given argument is not null. If it is, throws {@link IllegalArgumentException}.
     * Otherwise, returns the argument.
     *
     * @param <T> type of the given argument value.
     * @param name of the parameter, belongs to the exception message.
     * @param index of the array, belongs to the exception message.
     * @param value to check.
     * @return the given argument value.
     * @throws IllegalArgumentException if value is null.
     */
    public static <T> T checkNotNullArrayParam(T value, int index, String name) throws IllegalArgumentException {
        if (value == null) {
            throw new IllegalArgumentException(
                    "Array index " + index + " of parameter '" + name + "' must not be null");
        }
        return value;
    }

    /**
     * Checks that every element of the given array is not null. If one is, throws
     * {@link IllegalArgumentException} naming its index. Otherwise, returns the array.
     */
    public static <T> T[] checkNotNullElements(T[] array, String name) {
        checkNotNull(array, name);
        for (int i = 0; i < array.length; i++) {
            checkNotNullArrayParam(array[i], i, name);
        }
        return array;
    }

    /**
     * Checks that every element of the given collection is not null. If one is, throws
     * {@link IllegalArgumentException} naming its position. Otherwise, returns the collection.
     */
    public static <T extends Collection<?>> T checkNotNullElements(T collection, String name) {
        checkNotNull(collection, name);
        int index = 0;
        for (Object element : collection) {
            checkNotNullArrayParam(element, index++, name);
        }
        return collection;
    }

    /**
     * Checks that the given index lies in {@code [0, size)}. If it does not, throws
     * {@link IndexOutOfBoundsException}. Otherwise, returns the index.
     */
    public static int checkIndex(int index, int size, String name) {
        if (index < INT_ZERO || index >= size) {
            throw new IndexOutOfBoundsException(name + " : " + index + " (expected: 0 <= " + name + " < " + size + ')');
        }
        return index;
    }
}
