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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

import org.testng.annotations.Test;

public class SequencePolicyTest {

    private static void acceptAll(SequencePolicy.Tracker tracker, long... sequences) throws Exception {
        for (long seq : sequences) {
            tracker.check(seq);
            tracker.accept(seq);
        }
    }

    @Test
    public void strictShouldOnlyAcceptNextSequence() throws Exception {
        var tracker = SequencePolicy.strict().newTracker();
        acceptAll(tracker, 1, 2, 3);

        assertThat(tracker.lastAccepted()).isEqualTo(3);
        assertThatExceptionOfType(SequenceViolationException.class)
                .isThrownBy(() -> tracker.check(5))
                .satisfies(e -> {
                    assertThat(e.expected()).isEqualTo(4);
                    assertThat(e.actual()).isEqualTo(5);
                });
        assertThatExceptionOfType(SequenceViolationException.class).isThrownBy(() -> tracker.check(3));
    }

    @Test
    public void checkShouldNotChangeState() throws Exception {
        var tracker = SequencePolicy.strict().newTracker();
        tracker.check(1);
        tracker.check(1);
        assertThat(tracker.lastAccepted()).isZero();
    }

    @Test
    public void windowShouldAcceptReorderedMessages() throws Exception {
        var tracker = SequencePolicy.slidingWindow(4).newTracker();

        acceptAll(tracker, 2, 1, 4, 3);

        assertThat(tracker.lastAccepted()).isEqualTo(4);
    }

    @Test
    public void windowShouldRejectDuplicates() throws Exception {
        var tracker = SequencePolicy.slidingWindow(4).newTracker();
        acceptAll(tracker, 1, 3);

        assertThatExceptionOfType(SequenceViolationException.class).isThrownBy(() -> tracker.check(3));
        assertThatExceptionOfType(SequenceViolationException.class).isThrownBy(() -> tracker.check(1));
        assertThatCode(() -> tracker.check(2)).doesNotThrowAnyException();
    }

    @Test
    public void windowShouldRejectTooFarAheadOrBehind() throws Exception {
        var tracker = SequencePolicy.slidingWindow(4).newTracker();
        acceptAll(tracker, 4);

        assertThatExceptionOfType(SequenceViolationException.class).isThrownBy(() -> tracker.check(9));
        assertThatCode(() -> tracker.check(8)).doesNotThrowAnyException();

        acceptAll(tracker, 8);

        assertThatExceptionOfType(SequenceViolationException.class).isThrownBy(() -> tracker.check(4));
        assertThatCode(() -> tracker.check(5)).doesNotThrowAnyException();
    }

    @Test
    public void windowShouldForgetSlotsWhenAdvancing() throws Exception {
        var tracker = SequencePolicy.slidingWindow(2).newTracker();
        acceptAll(tracker, 1, 2, 3, 4);

        assertThatExceptionOfType(SequenceViolationException.class).isThrownBy(() -> tracker.check(4));
        assertThatCode(() -> tracker.check(5)).doesNotThrowAnyException();
    }
}
