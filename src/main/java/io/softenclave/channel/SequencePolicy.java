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

import java.util.BitSet;

/**
 * Decides which inbound sequence numbers a channel accepts. The default {@linkplain #strict() strict} policy only
 * accepts the next sequence number; the {@linkplain #slidingWindow(int) sliding window} policy tolerates bounded loss
 * and reordering while still rejecting duplicates.
 */
public interface SequencePolicy {

    static SequencePolicy strict() {
        return StrictTracker::new;
    }

    /**
     * A policy accepting any sequence number up to {@code windowSize} ahead of the highest accepted one, and any
     * unseen number less than {@code windowSize} behind it.
     */
    static SequencePolicy slidingWindow(int windowSize) {
        Require.between(windowSize, 1, 65536, "Window size must be between 1 and 65536");
        return () -> new WindowTracker(windowSize);
    }

    /**
     * Creates fresh per-channel tracking state.
     */
    Tracker newTracker();

    /**
     * Per-channel inbound sequence state. {@link #check(long)} never mutates state, so that a message which
     * subsequently fails is not counted.
     */
    interface Tracker {
        void check(long sequence) throws SequenceViolationException;

        void accept(long sequence);

        long lastAccepted();
    }

    final class StrictTracker implements Tracker {
        private long last = 0;

        @Override
        public void check(long sequence) throws SequenceViolationException {
            if (sequence != last + 1) {
                throw new SequenceViolationException(last + 1, sequence);
            }
        }

        @Override
        public void accept(long sequence) {
            last = sequence;
        }

        @Override
        public long lastAccepted() {
            return last;
        }
    }

    final class WindowTracker implements Tracker {
        private final int windowSize;
        // Slot (seq % windowSize) is set if seq was accepted, for seq in (highest - windowSize, highest]
        private final BitSet accepted;
        private long highest = 0;

        WindowTracker(int windowSize) {
            this.windowSize = windowSize;
            this.accepted = new BitSet(windowSize);
        }

        @Override
        public void check(long sequence) throws SequenceViolationException {
            if (sequence > highest) {
                if (sequence - highest > windowSize) {
                    throw new SequenceViolationException(highest + 1, sequence);
                }
            } else if (highest - sequence >= windowSize || accepted.get(slot(sequence))) {
                throw new SequenceViolationException(highest + 1, sequence);
            }
        }

        @Override
        public void accept(long sequence) {
            if (sequence > highest) {
                if (sequence - highest >= windowSize) {
                    accepted.clear();
                } else {
                    for (long s = highest + 1; s <= sequence; s++) {
                        accepted.clear(slot(s));
                    }
                }
                highest = sequence;
            }
            accepted.set(slot(sequence));
        }

        @Override
        public long lastAccepted() {
            return highest;
        }

        private int slot(long sequence) {
            return (int) (sequence % windowSize);
        }
    }
}
