package viewchange.vc;

/**
 * Receives the view changes of one node, on the node's update thread.
 */
public interface ViewChangeListener {
    ViewChangeListener NONE = new ViewChangeListener() {};

    //A quorum of ViewChange messages was collected for view, just before it is installed.
    //Not called when a view is installed from a proof.
    default void onQuorumReached(int view, int leaderId) {
    }

    default void onViewInstalled(int view, int leaderId) {
    }
}
