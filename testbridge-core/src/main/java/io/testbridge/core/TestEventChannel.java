/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.testbridge.core;

import io.testbridge.engine.FailFastTracker;
import io.testbridge.engine.TestEvent;
import io.testbridge.engine.TestEventSender;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Unbounded, order-preserving channel from many module producers to the single aggregator.
 * Closing appends an end marker (poison pill); events sent before {@link #close()} are all
 * delivered before {@link #receive()} reports the end.
 */
public class TestEventChannel {

    private record Envelope(TestEvent event) {
    }

    private static final Envelope END = new Envelope(null);

    private final BlockingQueue<Envelope> queue = new LinkedBlockingQueue<>();
    private volatile boolean closed;
    private boolean drained;

    public TestEventSender newSender(FailFastTracker tracker) {
        return new TestEventSender(this::send, tracker);
    }

    public void send(TestEvent event) {
        if (closed) {
            throw new IllegalStateException("channel closed, dropping " + event.kind());
        }
        queue.add(new Envelope(event));
    }

    public synchronized void close() {
        if (!closed) {
            closed = true;
            queue.add(END);
        }
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Block until the next event arrives.
     *
     * @return the next event, or null once the channel is closed and drained
     */
    public TestEvent receive() throws InterruptedException {
        if (drained) {
            return null;
        }
        Envelope envelope = queue.take();
        if (envelope == END) {
            drained = true;
            return null;
        }
        return envelope.event();
    }

}
