/*
 * Copyright 2022 Neil Madden.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 *
 */


package io.softenclave.channel;

import java.nio.ByteBuffer;
import java.util.LinkedHashSet;

/**
 * A bounded set of recently accepted nonces. When full, the oldest nonce is evicted first. Not thread-safe: the owning
 * {@link Channel} guards it.
 */
final class ReplayCache {
    static final int DEFAULT_CAPACITY = 4096;

    private final int capacity;
    private final LinkedHashSet<ByteBuffer> seen;

    ReplayCache(int capacity) {
        Require.require(capacity > 0, "Replay cache capacity must be positive");
        this.capacity = capacity;
        this.seen = new LinkedHashSet<>();
    }

    boolean contains(byte[] nonce) {
        return seen.contains(ByteBuffer.wrap(nonce));
    }

    void remember(byte[] nonce) {
        if (seen.add(ByteBuffer.wrap(nonce.clone())) && seen.size() > capacity) {
            var oldest = seen.iterator();
            oldest.next();
            oldest.remove();
        }
    }

    int size() {
        return seen.size();
    }

    int capacity() {
        return capacity;
    }

    void clear() {
        seen.clear();
    }
}
