// Protocol Buffers - Google's data interchange format
// Copyright 2008 Google Inc.  All rights reserved.
// https://developers.google.com/protocol-buffers/
//
// Redistribution and use in source and binary forms, with or without
// modification, are permitted provided that the following conditions are
// met:
//
//     * Redistributions of source code must retain the above copyright
// notice, this list of conditions and the following disclaimer.
//     * Redistributions in binary form must reproduce the above
// copyright notice, this list of conditions and the following disclaimer
// in the documentation and/or other materials provided with the
// distribution.
//     * Neither the name of Google Inc. nor the names of its
// contributors may be used to endorse or promote products derived from
// this software without specific prior written permission.
//
// THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS
// "AS IS" AND ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT
// LIMITED TO, THE IMPLIED WARRANTIES OF MERCHANTABILITY AND FITNESS FOR
// A PARTICULAR PURPOSE ARE DISCLAIMED. IN NO EVENT SHALL THE COPYRIGHT
// OWNER OR CONTRIBUTORS BE LIABLE FOR ANY DIRECT, INDIRECT, INCIDENTAL,
// SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES (INCLUDING, BUT NOT
// LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES; LOSS OF USE,
// DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND ON ANY
// THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
// (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE
// OF THIS SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.

package com.hellblazer.skymap.common;

import java.util.Arrays;
import java.util.RandomAccess;

/**
 * Chopped down int list, specialized for collecting pixel indices without boxing.
 *
 * @author hal.hildebrand
 */
public final class IntArrayList implements RandomAccess {

    private static final int DEFAULT_CAPACITY = 16;

    private int[] array;
    private int   size;

    public IntArrayList() {
        array = new int[DEFAULT_CAPACITY];
    }

    public void add(int element) {
        ensureCapacity(size + 1);
        array[size++] = element;
    }

    /**
     * Sort ascending in place.
     */
    public void sort() {
        Arrays.sort(array, 0, size);
    }

    public int[] toArray() {
        return Arrays.copyOf(array, size);
    }

    private void ensureCapacity(int minCapacity) {
        if (minCapacity > array.length) {
            var length = array.length;
            var newLength = Math.max(minCapacity, ((length * 3) / 2) + 1);
            array = Arrays.copyOf(array, newLength);
        }
    }
}
