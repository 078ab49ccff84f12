package com.questrail.homeshadow.api;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Node-list change actions reported by the controller, keyed by their two
 * letter wire code. The two device-progress actions have no wire code; they are
 * derived from progress report frames.
 */
public enum NodeChangeAction
{
    NODE_RENAMED("NN"),
    NODE_REMOVED("NR"),
    NODE_ADDED("ND"),
    NODE_MOVED_INTO_SCENE("MV"),
    LINK_CHANGED("CL"),
    NODE_REMOVED_FROM_GROUP("RG"),
    NODE_ENABLED("EN"),
    NODE_PARENT_CHANGED("PC"),
    POWER_INFO_CHANGED("PI"),
    DEVICE_ID_CHANGED("DI"),
    DEVICE_PROPERTY_CHANGED("DP"),
    GROUP_RENAMED("GN"),
    GROUP_REMOVED("GR"),
    GROUP_ADDED("GD"),
    FOLDER_ADDED("FD"),
    FOLDER_RENAMED("FN"),
    FOLDER_REMOVED("FR"),
    NODE_ERROR("NE"),
    CLEAR_ERROR("CE"),
    DISCOVERING_NODES("SN"),
    NODE_DISCOVERY_COMPLETE("SC"),
    NETWORK_RENAMED("WR"),
    PENDING_DEVICE_OPERATION("WH"),
    PROGRAMMING_DEVICE("WD"),
    NODE_REVISED("RV"),
    DEVICE_WRITING(null),
    DEVICE_MEMORY(null);

    private static final Map<String, NodeChangeAction> BY_CODE = new HashMap<>();

    static {
        for (NodeChangeAction action : values()) {
            if (action.code != null) {
                BY_CODE.put(action.code, action);
            }
        }
    }

    private final String code;

    NodeChangeAction(String code) {
        this.code = code;
    }

    public Optional<String> code() {
        return Optional.ofNullable(code);
    }

    public static Optional<NodeChangeAction> fromCode(String code) {
        return Optional.ofNullable(BY_CODE.get(code));
    }

    /**
     * Whether the action concerns a group rather than a node.
     */
    public boolean isGroupAction() {
        return this == GROUP_RENAMED || this == GROUP_REMOVED || this == GROUP_ADDED;
    }
}
