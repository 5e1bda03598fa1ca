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

import java.io.IOException;
import java.util.function.Consumer;

/**
 * An untrusted, message-oriented link between host and enclave. Implementations may drop, duplicate, reorder or
 * replay messages; the channel tolerates all of these. Messages that arrive before any handler is registered must be
 * buffered and delivered to the first handler.
 */
public interface Transport {

    void send(byte[] message) throws IOException;

    /**
     * Registers a handler for inbound messages. Handlers may be called from any thread.
     *
     * @param handler the handler to call for each inbound message.
     * @return a subscription that unregisters the handler when closed.
     */
    Subscription onReceive(Consumer<byte[]> handler);

    /**
     * A registered handler. Once {@link #close()} returns, even when called from inside the handler, the handler
     * receives no further messages and later messages are buffered for the next handler. Closing is idempotent.
     */
    interface Subscription extends AutoCloseable {
        @Override
        void close();
    }
}
