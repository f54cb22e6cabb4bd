package viewchange.net;

import viewchange.common.Message;
import viewchange.common.MessagePayload;

public interface InboundMessageConsumer {
    void accept(Message<MessagePayload> message);
}
