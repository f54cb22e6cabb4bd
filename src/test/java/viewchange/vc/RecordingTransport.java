package viewchange.vc;

import viewchange.common.MessagePayload;
import viewchange.net.Transport;

import java.util.ArrayList;
import java.util.List;

class RecordingTransport implements Transport {
    final List<MessagePayload> broadcasts = new ArrayList<>();
    final List<MessagePayload> unicasts = new ArrayList<>();

    @Override
    public void sendTo(int nodeId, MessagePayload message) {
        unicasts.add(message);
    }

    @Override
    public void broadcast(MessagePayload message) {
        broadcasts.add(message);
    }

    MessagePayload lastBroadcast() {
        return broadcasts.isEmpty() ? null : broadcasts.get(broadcasts.size() - 1);
    }

    void clear() {
        broadcasts.clear();
        unicasts.clear();
    }
}
