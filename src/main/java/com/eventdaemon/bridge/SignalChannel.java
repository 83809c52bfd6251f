package com.eventdaemon.bridge;

import com.eventdaemon.gateway.EventPayload;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Named broadcast channel. Receivers are called in connection order on the sending thread. A
 * receiver failure propagates to the sender and skips the receivers after it.
 */
public class SignalChannel {

    private final String name;
    private final List<SignalReceiver> receivers = new CopyOnWriteArrayList<>();

    SignalChannel(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public SignalReceiver connect(SignalReceiver receiver) {
        receivers.add(receiver);
        return receiver;
    }

    public boolean disconnect(SignalReceiver receiver) {
        return receivers.remove(receiver);
    }

    public int getReceiverCount() {
        return receivers.size();
    }

    public boolean hasReceivers() {
        return !receivers.isEmpty();
    }

    /**
     * Delivers {@code payload} to every receiver.
     *
     * @return number of receivers called
     */
    public int send(Object sender, EventPayload payload) throws Exception {
        int delivered = 0;
        for (SignalReceiver receiver : receivers) {
            receiver.receive(sender, payload);
            delivered++;
        }
        return delivered;
    }

    @Override
    public String toString() {
        return "SignalChannel[" + name + ", receivers=" + receivers.size() + "]";
    }
}
