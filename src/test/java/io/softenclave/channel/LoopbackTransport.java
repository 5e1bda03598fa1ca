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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Consumer;

/**
 * An in-memory transport pair. Each end delivers inbound messages in order on its own thread and buffers them while
 * no handler is registered.
 */
public final class LoopbackTransport implements Transport, AutoCloseable {
    private final String name;
    private final ExecutorService deliveryThread;
    private final Object lock = new Object();
    private final Deque<byte[]> inbox = new ArrayDeque<>();
    private final List<byte[]> sent = new CopyOnWriteArrayList<>();
    private LoopbackTransport peer;
    private Consumer<byte[]> handler;
    private volatile boolean dropOutbound;

    public record Pair(LoopbackTransport host, LoopbackTransport enclave) implements AutoCloseable {
        @Override
        public void close() {
            host.close();
            enclave.close();
        }
    }

    private LoopbackTransport(String name) {
        this.name = name;
        this.deliveryThread = Executors.newSingleThreadExecutor(runnable -> {
            var thread = new Thread(runnable, "loopback-" + name);
            thread.setDaemon(true);
            return thread;
        });
    }

    public static Pair create() {
        var host = new LoopbackTransport("host");
        var enclave = new LoopbackTransport("enclave");
        host.peer = enclave;
        enclave.peer = host;
        return new Pair(host, enclave);
    }

    @Override
    public void send(byte[] message) {
        sent.add(message.clone());
        if (!dropOutbound) {
            peer.inject(message.clone());
        }
    }

    @Override
    public Subscription onReceive(Consumer<byte[]> newHandler) {
        synchronized (lock) {
            if (handler != null) {
                throw new IllegalStateException(name + " already has a handler");
            }
            handler = newHandler;
        }
        deliveryThread.execute(this::drain);
        return () -> {
            synchronized (lock) {
                if (handler == newHandler) {
                    handler = null;
                }
            }
        };
    }

    /**
     * Delivers a message to this end as if the peer had sent it.
     */
    public void inject(byte[] message) {
        synchronized (lock) {
            inbox.add(message);
        }
        deliveryThread.execute(this::drain);
    }

    /**
     * Everything sent from this end, in order.
     */
    public List<byte[]> sentFrames() {
        return new ArrayList<>(sent);
    }

    public void dropOutbound(boolean drop) {
        this.dropOutbound = drop;
    }

    private void drain() {
        while (true) {
            Consumer<byte[]> current;
            byte[] message;
            synchronized (lock) {
                if (handler == null || inbox.isEmpty()) {
                    return;
                }
                current = handler;
                message = inbox.poll();
            }
            current.accept(message);
        }
    }

    @Override
    public void close() {
        deliveryThread.shutdownNow();
    }
}
