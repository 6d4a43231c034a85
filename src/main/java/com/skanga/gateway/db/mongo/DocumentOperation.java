package com.skanga.gateway.db.mongo;

import com.skanga.gateway.db.UnsupportedQueryOperationException;

/**
 * Operations accepted in the {@code operation} field of a document command.
 */
public enum DocumentOperation {
    FIND("find"),
    FIND_ONE("find_one"),
    AGGREGATE("aggregate"),
    COUNT("count"),
    INSERT_ONE("insert_one"),
    INSERT_MANY("insert_many"),
    UPDATE_ONE("update_one"),
    UPDATE_MANY("update_many"),
    DELETE_ONE("delete_one"),
    DELETE_MANY("delete_many");

    private final String wireName;

    DocumentOperation(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * @param wireName operation name exactly as it appears in the command
     * @return the matching operation
     * @throws UnsupportedQueryOperationException if no operation has that name
     */
    public static DocumentOperation fromWireName(String wireName) {
        for (DocumentOperation operation : values()) {
            if (operation.wireName.equals(wireName)) {
                return operation;
            }
        }
        throw new UnsupportedQueryOperationException(wireName);
    }
}
