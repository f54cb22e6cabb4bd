package viewchange.common;

import java.util.HashMap;
import java.util.Map;

public enum MessageId {
    ViewChange(2),
    ViewChangeProof(3);

    public static MessageId valueOf(Integer id) {
        return map.get(id);
    }

    int id;
    MessageId(int id) {
        this.id = id;
    }

    public int getId() {
        return id;
    }

    private static final Map<Integer, MessageId> map = new HashMap<>();
    static {
        for (MessageId messageId : MessageId.values()) {
            map.put(messageId.id, messageId);
        }
    }
}
