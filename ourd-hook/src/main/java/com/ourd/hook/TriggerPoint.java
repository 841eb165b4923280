package com.ourd.hook;

/**
 * Points in the record write path where hooks run.
 * {@code before-*} hooks may veto the operation; {@code after-*} hooks only observe it.
 */
public enum TriggerPoint {

    BEFORE_SAVE("before-save"),
    AFTER_SAVE("after-save"),
    BEFORE_DELETE("before-delete"),
    AFTER_DELETE("after-delete");

    private final String wireName;

    TriggerPoint(String wireName) {
        this.wireName = wireName;
    }

    /** Name used in plugin handshakes and logs (e.g. {@code before-save}). */
    public String getWireName() {
        return wireName;
    }

    public boolean isBefore() {
        return this == BEFORE_SAVE || this == BEFORE_DELETE;
    }

    /**
     * Parses a wire name such as {@code before-save}.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static TriggerPoint fromWireName(String name) {
        if (name != null) {
            String n = name.trim();
            for (TriggerPoint t : values()) {
                if (t.wireName.equalsIgnoreCase(n)) return t;
            }
        }
        throw new IllegalArgumentException("Unknown trigger point: " + name);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
