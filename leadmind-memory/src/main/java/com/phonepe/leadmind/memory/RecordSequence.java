/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.leadmind.memory;

import com.phonepe.leadmind.core.model.MemoryRecord;
import org.jetbrains.annotations.NotNull;

import java.util.Iterator;
import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy, finite and restartable sequence of query results. Nothing is read until iteration starts, and every new
 * iteration runs the underlying tier query again.
 */
public class RecordSequence implements Iterable<MemoryRecord> {
    private final Supplier<List<MemoryRecord>> source;

    RecordSequence(Supplier<List<MemoryRecord>> source) {
        this.source = source;
    }

    @NotNull
    @Override
    public Iterator<MemoryRecord> iterator() {
        return source.get().iterator();
    }

    public Stream<MemoryRecord> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    public List<MemoryRecord> toList() {
        return source.get();
    }
}
