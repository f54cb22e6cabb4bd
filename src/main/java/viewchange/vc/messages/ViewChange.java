package viewchange.vc.messages;

import com.google.common.base.Objects;
import viewchange.common.MessageId;
import viewchange.common.MessagePayload;

public class ViewChange extends MessagePayload {
    public final int view;

    public ViewChange(int view) {
        super(MessageId.ViewChange);
        this.view = view;
    }

    @Override
    public boolean isWellFormed() {
        return view >= 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ViewChange that = (ViewChange) o;
        return view == that.view;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(messageId, view);
    }

    @Override
    public String toString() {
        return "ViewChange{view=" + view + '}';
    }
}
