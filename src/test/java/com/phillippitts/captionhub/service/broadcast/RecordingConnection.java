package com.phillippitts.captionhub.service.broadcast;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory subscriber transport that records every frame it is sent.
 */
class RecordingConnection implements SubscriberConnection {

    private final String id;
    private final List<OutboundMessage> sent = new CopyOnWriteArrayList<>();
    private final AtomicReference<DisconnectReason> closedWith = new AtomicReference<>();
    private final CountDownLatch gate;
    private volatile boolean failSends = false;

    RecordingConnection(String id) {
        this(id, false);
    }

    /**
     * @param blocking when true every send parks until the connection is closed
     */
    RecordingConnection(String id, boolean blocking) {
        this.id = id;
        this.gate = new CountDownLatch(blocking ? 1 : 0);
    }

    void failSends() {
        this.failSends = true;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public void send(OutboundMessage message) throws IOException {
        try {
            gate.await(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("interrupted", e);
        }
        if (failSends || closedWith.get() != null) {
            throw new IOException("connection reset");
        }
        sent.add(message);
    }

    @Override
    public void close(DisconnectReason reason) {
        closedWith.compareAndSet(null, reason);
        gate.countDown();
    }

    @Override
    public boolean isOpen() {
        return closedWith.get() == null;
    }

    List<OutboundMessage> sent() {
        return sent;
    }

    List<Long> captionSequences() {
        return sent.stream().filter(OutboundMessage::isCaption).map(OutboundMessage::sequence).toList();
    }

    List<OutboundMessage.Type> types() {
        return sent.stream().map(OutboundMessage::type).toList();
    }

    DisconnectReason closedWith() {
        return closedWith.get();
    }
}
